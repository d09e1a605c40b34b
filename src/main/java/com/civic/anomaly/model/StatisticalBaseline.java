package com.civic.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Statistical summary of a metric, the reference for outlier detection")
public class StatisticalBaseline {

    @Schema(description = "Metric name", example = "transaction_amount")
    private String metricName;

    @Schema(description = "Entity type the metric is measured on", example = "order")
    private String entityType;

    @Schema(description = "Time period label", example = "daily")
    private String timePeriod;

    private double mean;
    private double stddev;
    private double median;
    private double q1;
    private double q3;

    @Schema(description = "Number of samples the baseline was computed from", example = "1250")
    private long sampleSize;

    @Schema(description = "Calculation time in epoch milliseconds", example = "1739886764000")
    private long calculatedAt;

    public static String key(String metricName, String entityType, String timePeriod) {
        return metricName + "|" + entityType + "|" + timePeriod;
    }

    public String key() {
        return key(metricName, entityType, timePeriod);
    }

    public boolean isUsable() {
        return sampleSize > 0;
    }

    public double iqr() {
        return q3 - q1;
    }
}
