package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import java.util.List;
import lombok.Getter;

/**
 * A 0/1 maximization program: binary variables, an objective vector and linear rows.
 *
 * <p>For lineups the first variables are player selection indicators; auxiliary indicators
 * (one per game when a minimum game count applies) follow them.
 */
@Getter
public final class IntegerProgram {

    private final int variableCount;
    private final double[] objective;
    private final List<ProgramRow> rows;

    public IntegerProgram(int variableCount, double[] objective, List<ProgramRow> rows) {
        if (objective.length != variableCount) {
            throw new IllegalArgumentException("Objective length " + objective.length + " != " + variableCount);
        }
        for (ProgramRow row : rows) {
            if (row.coefficients().length != variableCount) {
                throw new IllegalArgumentException("Row width " + row.coefficients().length + " != " + variableCount);
            }
        }
        this.variableCount = variableCount;
        this.objective = objective;
        this.rows = List.copyOf(rows);
    }

    /** Same program without the rows of the given constraint class. Used to diagnose infeasibility. */
    public IntegerProgram without(InfeasibilityCause cause) {
        List<ProgramRow> kept = rows.stream().filter(r -> r.cause() != cause).toList();
        return new IntegerProgram(variableCount, objective, kept);
    }

    /** Same rows with a zero objective, so any feasible point is optimal. */
    public IntegerProgram feasibilityOnly() {
        return new IntegerProgram(variableCount, new double[variableCount], rows);
    }

    public boolean hasRowsFor(InfeasibilityCause cause) {
        return rows.stream().anyMatch(r -> r.cause() == cause);
    }
}
