package com.dfsoptimizer.correlation;

import com.dfsoptimizer.domain.model.CorrelationEntry;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.exception.InvalidCorrelationException;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DiagonalMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the pool-wide correlation matrix from sparse pairwise entries.
 *
 * <p>Unspecified pairs default to 0 and the diagonal is 1. Heuristic pairwise coefficients are
 * not guaranteed to form a valid joint matrix, so after default-filling the matrix is checked
 * with an eigen-decomposition and, when its smallest eigenvalue falls below
 * {@link #EIGENVALUE_FLOOR}, corrected by eigenvalue clipping:
 * <ol>
 *   <li>decompose C = V diag(lambda) V^T</li>
 *   <li>replace every lambda below the floor with the floor</li>
 *   <li>rebuild, then rescale to unit diagonal: C' = D^-1/2 C D^-1/2</li>
 * </ol>
 * The rescaling is a congruence, so the result stays positive definite and its Cholesky
 * factorization succeeds. The correction and its largest entry change are logged and recorded
 * on the returned matrix.
 */
@Component
public class CorrelationMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(CorrelationMatrixBuilder.class);

    /** Smallest eigenvalue kept after clipping. Strictly positive so Cholesky never sees a singular matrix. */
    static final double EIGENVALUE_FLOOR = 1e-6;

    private static final double SYMMETRY_TOLERANCE = 1e-12;

    /**
     * @throws InvalidCorrelationException for coefficients outside [-1, 1], unknown players,
     *         conflicting duplicate pairs, or a matrix that cannot be decomposed
     */
    public CorrelationMatrix build(PlayerPool pool, List<CorrelationEntry> entries) {
        int n = pool.size();
        double[][] raw = new double[n][n];
        for (int i = 0; i < n; i++) {
            raw[i][i] = 1.0;
        }

        Map<Long, Double> seenPairs = new HashMap<>();
        if (entries != null) {
            for (CorrelationEntry entry : entries) {
                applyEntry(pool, raw, seenPairs, entry);
            }
        }

        double[][] corrected;
        double rawMinEigenvalue;
        boolean needsCorrection;
        try {
            EigenDecomposition decomposition = new EigenDecomposition(new Array2DRowRealMatrix(raw, false));
            double[] eigenvalues = decomposition.getRealEigenvalues();
            rawMinEigenvalue = min(eigenvalues);
            needsCorrection = rawMinEigenvalue < EIGENVALUE_FLOOR;
            corrected = needsCorrection ? clipEigenvalues(decomposition, eigenvalues, n) : raw;
        } catch (MathArithmeticException | MaxCountExceededException e) {
            throw new InvalidCorrelationException("Correlation matrix could not be decomposed", e);
        }

        double maxAdjustment = 0.0;
        if (needsCorrection) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    maxAdjustment = Math.max(maxAdjustment, Math.abs(corrected[i][j] - raw[i][j]));
                }
            }
            log.warn(
                    "Correlation matrix was not positive definite (min eigenvalue {}), applied eigenvalue clipping;"
                            + " largest entry change {}",
                    rawMinEigenvalue,
                    maxAdjustment);
        }

        List<String> ids = pool.getPlayers().stream().map(Player::getId).toList();
        log.debug("Built {}x{} correlation matrix from {} entries", n, n, entries != null ? entries.size() : 0);
        return new CorrelationMatrix(ids, corrected, needsCorrection, rawMinEigenvalue, maxAdjustment);
    }

    private void applyEntry(PlayerPool pool, double[][] raw, Map<Long, Double> seenPairs, CorrelationEntry entry) {
        double coefficient = entry.getCoefficient();
        if (!Double.isFinite(coefficient) || coefficient < -1.0 || coefficient > 1.0) {
            throw new InvalidCorrelationException(
                    "Correlation coefficient out of [-1, 1]: " + entry, details(entry));
        }
        int i = pool.indexOf(entry.getPlayerA());
        int j = pool.indexOf(entry.getPlayerB());
        if (i < 0 || j < 0) {
            throw new InvalidCorrelationException("Correlation entry references unknown player: " + entry, details(entry));
        }
        if (i == j) {
            if (Math.abs(coefficient - 1.0) > SYMMETRY_TOLERANCE) {
                throw new InvalidCorrelationException("Self-correlation must be 1: " + entry, details(entry));
            }
            return;
        }
        long key = pairKey(i, j);
        Double previous = seenPairs.put(key, coefficient);
        if (previous != null && Math.abs(previous - coefficient) > SYMMETRY_TOLERANCE) {
            throw new InvalidCorrelationException(
                    "Conflicting coefficients for pair " + entry.getPlayerA() + "/" + entry.getPlayerB(), details(entry));
        }
        raw[i][j] = coefficient;
        raw[j][i] = coefficient;
    }

    private double[][] clipEigenvalues(EigenDecomposition decomposition, double[] eigenvalues, int n) {
        double[] clipped = new double[n];
        for (int k = 0; k < n; k++) {
            clipped[k] = Math.max(eigenvalues[k], EIGENVALUE_FLOOR);
        }
        RealMatrix v = decomposition.getV();
        RealMatrix rebuilt = v.multiply(new DiagonalMatrix(clipped)).multiply(decomposition.getVT());

        double[][] result = new double[n][n];
        double[] scale = new double[n];
        for (int i = 0; i < n; i++) {
            scale[i] = 1.0 / Math.sqrt(rebuilt.getEntry(i, i));
        }
        for (int i = 0; i < n; i++) {
            result[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double symmetric = 0.5 * (rebuilt.getEntry(i, j) + rebuilt.getEntry(j, i));
                double value = clamp(symmetric * scale[i] * scale[j]);
                result[i][j] = value;
                result[j][i] = value;
            }
        }
        return result;
    }

    private static long pairKey(int i, int j) {
        int lo = Math.min(i, j);
        int hi = Math.max(i, j);
        return ((long) lo << 32) | hi;
    }

    private static double min(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    private static double clamp(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }

    private static Map<String, Object> details(CorrelationEntry entry) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("playerA", entry.getPlayerA());
        details.put("playerB", entry.getPlayerB());
        details.put("coefficient", entry.getCoefficient());
        return details;
    }
}
