package com.dnssentinel.core.analytics;

import java.io.Serializable;
import java.util.Collection;

/**
 * Mean and sample standard deviation of per-bucket query counts.
 *
 * @since 1.0.0
 */
public final class BucketStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    static final BucketStatistics EMPTY = new BucketStatistics(0, 0, 0);

    private final double mean;
    private final double stdDev;
    private final int samples;

    BucketStatistics(double mean, double stdDev, int samples) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.samples = samples;
    }

    /**
     * Compute statistics over {@code values}. The standard deviation uses the
     * n - 1 denominator and is 0 for fewer than two samples.
     */
    static BucketStatistics of(Collection<? extends Number> values) {
        int n = values.size();
        if (n == 0) {
            return EMPTY;
        }
        double sum = 0;
        for (Number v : values) {
            sum += v.doubleValue();
        }
        double mean = sum / n;
        if (n == 1) {
            return new BucketStatistics(mean, 0, 1);
        }
        double squares = 0;
        for (Number v : values) {
            double diff = v.doubleValue() - mean;
            squares += diff * diff;
        }
        return new BucketStatistics(mean, Math.sqrt(squares / (n - 1)), n);
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public int getSamples() {
        return samples;
    }

    /**
     * The trained standard deviation, or {@code max(sqrt(mean), 1)} when the
     * baseline had no variance at all.
     */
    double effectiveStdDev() {
        return stdDev > 0 ? stdDev : Math.max(Math.sqrt(mean), 1.0);
    }

    @Override
    public String toString() {
        return String.format("BucketStatistics{mean=%.2f, stdDev=%.2f, samples=%d}", mean, stdDev, samples);
    }
}
