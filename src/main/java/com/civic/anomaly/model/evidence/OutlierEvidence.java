package com.civic.anomaly.model.evidence;

import java.util.List;

/**
 * Value that fell outside its metric baseline. {@code zscore} is null when the
 * baseline had zero spread.
 */
public record OutlierEvidence(String metric,
                              String sampleId,
                              double value,
                              double baselineMean,
                              double baselineStddev,
                              double baselineQ1,
                              double baselineQ3,
                              long baselineSampleSize,
                              Double zscore,
                              double lowerBound,
                              double upperBound,
                              boolean degenerateIqr,
                              List<String> triggeredBy) implements FindingEvidence {

    public static final String BY_Z_SCORE = "z_score";
    public static final String BY_IQR = "iqr";
}
