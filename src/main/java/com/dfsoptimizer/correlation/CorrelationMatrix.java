package com.dfsoptimizer.correlation;

import java.util.List;
import lombok.Getter;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Full pairwise correlation matrix over a player pool, indexed in pool order.
 *
 * <p>Guaranteed symmetric, unit diagonal, entries in [-1, 1] and positive definite (the builder
 * applies eigenvalue clipping when the raw input is not). Read-only after construction and
 * shared across simulation workers without locking.
 */
public final class CorrelationMatrix {

    private final List<String> playerIds;
    private final double[][] values;

    /** True when the raw matrix needed a nearest-PSD correction. */
    @Getter
    private final boolean corrected;

    /** Smallest eigenvalue of the raw, default-filled matrix. */
    @Getter
    private final double rawMinEigenvalue;

    /** Largest absolute change applied to any off-diagonal entry by the correction. */
    @Getter
    private final double maxAdjustment;

    CorrelationMatrix(
            List<String> playerIds, double[][] values, boolean corrected, double rawMinEigenvalue, double maxAdjustment) {
        this.playerIds = List.copyOf(playerIds);
        this.values = values;
        this.corrected = corrected;
        this.rawMinEigenvalue = rawMinEigenvalue;
        this.maxAdjustment = maxAdjustment;
    }

    public int size() {
        return playerIds.size();
    }

    public List<String> getPlayerIds() {
        return playerIds;
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double get(String playerA, String playerB) {
        int i = playerIds.indexOf(playerA);
        int j = playerIds.indexOf(playerB);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Unknown player in correlation lookup: " + playerA + ", " + playerB);
        }
        return values[i][j];
    }

    /** Copy of the rows/columns at the given pool indices, in the given order. */
    public RealMatrix subMatrix(int[] indices) {
        double[][] sub = new double[indices.length][indices.length];
        for (int a = 0; a < indices.length; a++) {
            for (int b = 0; b < indices.length; b++) {
                sub[a][b] = values[indices[a]][indices[b]];
            }
        }
        return new Array2DRowRealMatrix(sub, false);
    }
}
