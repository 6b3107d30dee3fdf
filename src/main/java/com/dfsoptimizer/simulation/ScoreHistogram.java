package com.dfsoptimizer.simulation;

/**
 * Fixed-width streaming histogram. Percentiles are read back at bin resolution, interpolated
 * inside the bin, so memory stays constant no matter how many trials are added.
 *
 * <p>Values beyond the configured range land in the edge bins; the exact minimum and maximum
 * are tracked separately and bound the interpolation. Not thread-safe: each chunk fills its own
 * histogram and the results are merged afterwards.
 */
public final class ScoreHistogram {

    private final double origin;
    private final double binWidth;
    private final long[] counts;
    private long total;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public ScoreHistogram(double origin, double binWidth, int binCount) {
        this.origin = origin;
        this.binWidth = binWidth;
        this.counts = new long[binCount];
    }

    /** A histogram covering [lower, upper] with the given bin width. */
    public static ScoreHistogram covering(double lower, double upper, double binWidth) {
        double origin = Math.floor(lower / binWidth) * binWidth;
        int bins = (int) Math.ceil((upper - origin) / binWidth) + 1;
        return new ScoreHistogram(origin, binWidth, Math.max(bins, 1));
    }

    /** Same layout, no counts. */
    public ScoreHistogram emptyCopy() {
        return new ScoreHistogram(origin, binWidth, counts.length);
    }

    public void add(double value) {
        int bin = (int) Math.floor((value - origin) / binWidth);
        if (bin < 0) {
            bin = 0;
        } else if (bin >= counts.length) {
            bin = counts.length - 1;
        }
        counts[bin]++;
        total++;
        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
    }

    public void merge(ScoreHistogram other) {
        if (other.counts.length != counts.length || other.origin != origin || other.binWidth != binWidth) {
            throw new IllegalArgumentException("Cannot merge histograms with different layouts");
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] += other.counts[i];
        }
        total += other.total;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
    }

    /**
     * @param quantile in [0, 1]
     * @return the interpolated quantile, or NaN when empty
     */
    public double percentile(double quantile) {
        if (total == 0) {
            return Double.NaN;
        }
        double rank = quantile * total;
        long cumulative = 0;
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == 0) {
                continue;
            }
            if (cumulative + counts[i] >= rank) {
                double fraction = (rank - cumulative) / counts[i];
                double value = origin + (i + fraction) * binWidth;
                return Math.max(min, Math.min(max, value));
            }
            cumulative += counts[i];
        }
        return max;
    }

    public long getTotal() {
        return total;
    }

    public int getBinCount() {
        return counts.length;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /** Heap footprint estimate for a histogram with the given bin count. */
    public static long estimateBytes(int binCount) {
        return 16L + 8L * binCount + 48L;
    }
}
