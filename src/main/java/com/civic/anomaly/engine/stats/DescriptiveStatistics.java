package com.civic.anomaly.engine.stats;

import java.util.Arrays;
import java.util.Collection;

/**
 * Summary statistics used for baselines and entity-relative deviations.
 * Standard deviation is the sample standard deviation (n - 1), zero when n <= 1.
 * Percentiles are continuous with linear interpolation between closest ranks.
 */
public final class DescriptiveStatistics {

    private DescriptiveStatistics() {
    }

    /**
     * @param count  number of values
     * @param mean   arithmetic mean
     * @param stddev sample standard deviation
     * @param median 50th percentile
     * @param q1     25th percentile
     * @param q3     75th percentile
     * @param min    smallest value
     * @param max    largest value
     */
    public record Summary(long count, double mean, double stddev, double median,
                          double q1, double q3, double min, double max) {

        public static final Summary EMPTY = new Summary(0, 0, 0, 0, 0, 0, 0, 0);

        public double iqr() {
            return q3 - q1;
        }

        public boolean isEmpty() {
            return count == 0;
        }
    }

    public static Summary summarize(Collection<? extends Number> values) {
        double[] array = new double[values.size()];
        int i = 0;
        for (Number value : values) {
            array[i++] = value.doubleValue();
        }
        return summarize(array);
    }

    public static Summary summarize(double[] values) {
        int n = values.length;
        if (n == 0) return Summary.EMPTY;

        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double mean = mean(sorted);
        return new Summary(n, mean, sampleStddev(sorted, mean),
                percentile(sorted, 0.5), percentile(sorted, 0.25), percentile(sorted, 0.75),
                sorted[0], sorted[n - 1]);
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double sampleStddev(double[] values, double mean) {
        int n = values.length;
        if (n <= 1) return 0.0;
        // two-pass to avoid cancellation on large values
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (n - 1));
    }

    /**
     * Continuous percentile of already sorted values, p in [0, 1].
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) throw new IllegalArgumentException("No values");
        if (p < 0.0 || p > 1.0) throw new IllegalArgumentException("Percentile out of range: " + p);

        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        if (lower == upper) return sorted[lower];
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * Standard score of {@code value}, or null when the spread is zero.
     */
    public static Double zScore(double value, double mean, double stddev) {
        if (!(stddev > 0.0)) return null;
        return (value - mean) / stddev;
    }
}
