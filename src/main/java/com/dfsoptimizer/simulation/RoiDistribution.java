package com.dfsoptimizer.simulation;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Spread of simulated ROI across the lineups of one run. */
@Getter
@Builder
public class RoiDistribution {

    private final int lineups;
    private final double mean;
    private final double median;
    private final double stdDev;
    private final double min;
    private final double max;

    /** Fraction of lineups with a positive expected ROI. */
    private final double positiveRate;

    private final double p10;
    private final double p25;
    private final double p75;
    private final double p90;

    public static RoiDistribution of(List<Double> rois) {
        if (rois.isEmpty()) {
            return RoiDistribution.builder().build();
        }
        DescriptiveStatistics stats = new DescriptiveStatistics();
        rois.forEach(stats::addValue);
        long positive = rois.stream().filter(r -> r > 0).count();
        return RoiDistribution.builder()
                .lineups(rois.size())
                .mean(stats.getMean())
                .median(stats.getPercentile(50))
                .stdDev(rois.size() > 1 ? stats.getStandardDeviation() : 0.0)
                .min(stats.getMin())
                .max(stats.getMax())
                .positiveRate((double) positive / rois.size())
                .p10(stats.getPercentile(10))
                .p25(stats.getPercentile(25))
                .p75(stats.getPercentile(75))
                .p90(stats.getPercentile(90))
                .build();
    }
}
