package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.InfeasibilityCause;

/**
 * One linear constraint {@code lower <= a.x <= upper} of a lineup program, tagged with the
 * constraint class it encodes so an infeasible program can be traced back to the rule that broke
 * it. Open sides are infinite.
 */
public record ProgramRow(double[] coefficients, double lower, double upper, InfeasibilityCause cause) {

    public static ProgramRow atMost(double[] coefficients, double upper, InfeasibilityCause cause) {
        return new ProgramRow(coefficients, Double.NEGATIVE_INFINITY, upper, cause);
    }

    public static ProgramRow atLeast(double[] coefficients, double lower, InfeasibilityCause cause) {
        return new ProgramRow(coefficients, lower, Double.POSITIVE_INFINITY, cause);
    }

    public static ProgramRow exactly(double[] coefficients, double value, InfeasibilityCause cause) {
        return new ProgramRow(coefficients, value, value, cause);
    }
}
