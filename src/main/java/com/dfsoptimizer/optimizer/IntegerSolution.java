package com.dfsoptimizer.optimizer;

/** Optimal integral point of an {@link IntegerProgram}, with the solver's wall time. */
public record IntegerSolution(double[] values, double objectiveValue, long wallTimeMs) {}
