package com.dfsoptimizer.simulation;

/**
 * Running sums for one chunk of trials: per lineup score moments, histogram, target
 * exceedance and field-model outcomes, and per player score moments, histogram and
 * boom/bust counts. Chunks are merged in chunk order, which keeps results independent of
 * thread scheduling.
 */
final class ChunkAccumulator {

    long trials;

    final double[] lineupSum;
    final double[] lineupSumSquares;
    final long[] aboveTarget;
    final double[] winProbabilitySum;
    final double[] rankSum;
    final double[] roiSum;
    final ScoreHistogram[] lineupHistograms;

    final double[] playerSum;
    final double[] playerSumSquares;
    final long[] boomCount;
    final long[] bustCount;
    final ScoreHistogram[] playerHistograms;

    ChunkAccumulator(ScoreHistogram[] lineupLayouts, ScoreHistogram[] playerLayouts) {
        int lineups = lineupLayouts.length;
        int players = playerLayouts.length;
        lineupSum = new double[lineups];
        lineupSumSquares = new double[lineups];
        aboveTarget = new long[lineups];
        winProbabilitySum = new double[lineups];
        rankSum = new double[lineups];
        roiSum = new double[lineups];
        lineupHistograms = new ScoreHistogram[lineups];
        for (int i = 0; i < lineups; i++) {
            lineupHistograms[i] = lineupLayouts[i].emptyCopy();
        }
        playerSum = new double[players];
        playerSumSquares = new double[players];
        boomCount = new long[players];
        bustCount = new long[players];
        playerHistograms = new ScoreHistogram[players];
        for (int i = 0; i < players; i++) {
            playerHistograms[i] = playerLayouts[i].emptyCopy();
        }
    }

    void merge(ChunkAccumulator other) {
        trials += other.trials;
        for (int i = 0; i < lineupSum.length; i++) {
            lineupSum[i] += other.lineupSum[i];
            lineupSumSquares[i] += other.lineupSumSquares[i];
            aboveTarget[i] += other.aboveTarget[i];
            winProbabilitySum[i] += other.winProbabilitySum[i];
            rankSum[i] += other.rankSum[i];
            roiSum[i] += other.roiSum[i];
            lineupHistograms[i].merge(other.lineupHistograms[i]);
        }
        for (int i = 0; i < playerSum.length; i++) {
            playerSum[i] += other.playerSum[i];
            playerSumSquares[i] += other.playerSumSquares[i];
            boomCount[i] += other.boomCount[i];
            bustCount[i] += other.bustCount[i];
            playerHistograms[i].merge(other.playerHistograms[i]);
        }
    }

    static double mean(double sum, long n) {
        return n > 0 ? sum / n : Double.NaN;
    }

    /** Sample standard deviation from running sums. */
    static double stdDev(double sum, double sumSquares, long n) {
        if (n < 2) {
            return 0.0;
        }
        double mean = sum / n;
        double variance = (sumSquares - n * mean * mean) / (n - 1);
        return Math.sqrt(Math.max(variance, 0.0));
    }
}
