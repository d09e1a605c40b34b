package com.civic.anomaly.model.evidence;

import java.util.List;

public record HourlyDeviationEvidence(int hour,
                                      long count,
                                      double hourlyMean,
                                      double hourlyStddev,
                                      double zscore,
                                      List<Integer> flaggedHours,
                                      String zone) implements FindingEvidence {
}
