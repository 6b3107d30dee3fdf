package com.dfsoptimizer.simulation;

import com.dfsoptimizer.correlation.CorrelationMatrix;
import com.dfsoptimizer.exception.InvalidCorrelationException;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSquareMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Gaussian-copula sampler over a subset of the pool.
 *
 * <p>The lower Cholesky factor L of the correlation sub-matrix turns independent standard
 * normals e into correlated ones, {@code z = L e}; each z is then pushed through the player's
 * {@link MarginalDistribution}. The factor is computed once and only read afterwards, so one
 * sampler serves every chunk worker; each worker brings its own generator and buffers.
 */
public final class CorrelatedSampler {

    private final int[] poolIndices;
    private final double[][] lower;
    private final List<MarginalDistribution> marginals;

    private CorrelatedSampler(int[] poolIndices, double[][] lower, List<MarginalDistribution> marginals) {
        this.poolIndices = poolIndices;
        this.lower = lower;
        this.marginals = List.copyOf(marginals);
    }

    /**
     * @param matrix      pool-wide corrected correlation matrix
     * @param poolIndices pool indices of the simulated players; sample slot i is player poolIndices[i]
     * @param marginals   one marginal per simulated player, same order
     * @throws InvalidCorrelationException when the sub-matrix has no Cholesky factor
     */
    public static CorrelatedSampler create(
            CorrelationMatrix matrix, int[] poolIndices, List<MarginalDistribution> marginals) {
        if (marginals.size() != poolIndices.length) {
            throw new IllegalArgumentException("One marginal per simulated player required");
        }
        RealMatrix sub = matrix.subMatrix(poolIndices);
        try {
            RealMatrix factor = new CholeskyDecomposition(sub).getL();
            return new CorrelatedSampler(poolIndices.clone(), factor.getData(), marginals);
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException | NonSquareMatrixException e) {
            throw new InvalidCorrelationException(
                    "Correlation sub-matrix is not positive definite", Map.of("players", poolIndices.length));
        }
    }

    public int size() {
        return poolIndices.length;
    }

    /**
     * Draws one joint outcome into {@code scores}.
     *
     * @param random     the calling worker's generator
     * @param independent scratch buffer of length {@link #size()}
     * @param scores      output buffer of length {@link #size()}
     */
    public void draw(RandomGenerator random, double[] independent, double[] scores) {
        int n = poolIndices.length;
        for (int i = 0; i < n; i++) {
            independent[i] = random.nextGaussian();
        }
        for (int i = 0; i < n; i++) {
            double[] row = lower[i];
            double z = 0.0;
            for (int k = 0; k <= i; k++) {
                z += row[k] * independent[k];
            }
            scores[i] = marginals.get(i).fromStandardNormal(z);
        }
    }
}
