package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.enums.InfeasibilityCause;
import com.dfsoptimizer.exception.InfeasibleException;
import com.dfsoptimizer.exception.SolverTimeoutException;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Solves {@link IntegerProgram}s with an OR-Tools mixed-integer backend (SCIP by default, CBC
 * when SCIP is not bundled).
 *
 * <p>Every call builds and frees its own native {@link MPSolver}, so the component holds no
 * mutable state and concurrent batches never share solver state.
 */
@Component
public class MipSolver {

    private static final Logger log = LoggerFactory.getLogger(MipSolver.class);

    public static final String DEFAULT_BACKEND = "SCIP";
    private static final String FALLBACK_BACKEND = "CBC";

    public MipSolver() {
        Loader.loadNativeLibraries();
    }

    /**
     * Solves the program to proven optimality.
     *
     * @param program     the program to maximize
     * @param backend     OR-Tools backend id, e.g. SCIP or CBC
     * @param timeLimitMs wall-clock budget for this solve
     * @throws InfeasibleException    when the program has no integral point
     * @throws SolverTimeoutException when optimality is not proven inside the budget
     */
    public IntegerSolution solve(IntegerProgram program, String backend, long timeLimitMs) {
        MPSolver solver = create(backend);
        try {
            MPVariable[] variables = load(solver, program);
            solver.setTimeLimit(Math.max(1L, timeLimitMs));
            MPSolver.ResultStatus status = solver.solve();

            if (status == MPSolver.ResultStatus.OPTIMAL) {
                double[] values = new double[variables.length];
                for (int v = 0; v < variables.length; v++) {
                    values[v] = variables[v].solutionValue();
                }
                long wallTime = solver.wallTime();
                log.debug("{} solved {} vars x {} rows in {}ms, objective {}",
                        backend, program.getVariableCount(), program.getRows().size(), wallTime,
                        solver.objective().value());
                return new IntegerSolution(values, solver.objective().value(), wallTime);
            }
            if (status == MPSolver.ResultStatus.INFEASIBLE) {
                throw new InfeasibleException(InfeasibilityCause.UNKNOWN, "Lineup program has no integral solution");
            }
            if (status == MPSolver.ResultStatus.FEASIBLE || status == MPSolver.ResultStatus.NOT_SOLVED) {
                throw new SolverTimeoutException(
                        "Lineup solve exceeded time budget of " + timeLimitMs + "ms (" + status + ")", timeLimitMs);
            }
            throw new IllegalStateException("Solver " + backend + " ended with status " + status);
        } finally {
            solver.delete();
        }
    }

    /**
     * True when the program has at least one integral point. A check that runs out of time
     * counts as not feasible.
     */
    public boolean isFeasible(IntegerProgram program, String backend, long timeLimitMs) {
        MPSolver solver = create(backend);
        try {
            load(solver, program.feasibilityOnly());
            solver.setTimeLimit(Math.max(1L, timeLimitMs));
            MPSolver.ResultStatus status = solver.solve();
            return status == MPSolver.ResultStatus.OPTIMAL || status == MPSolver.ResultStatus.FEASIBLE;
        } finally {
            solver.delete();
        }
    }

    private static MPSolver create(String backend) {
        MPSolver solver = MPSolver.createSolver(backend);
        if (solver == null && !FALLBACK_BACKEND.equals(backend)) {
            log.warn("OR-Tools backend {} unavailable, falling back to {}", backend, FALLBACK_BACKEND);
            solver = MPSolver.createSolver(FALLBACK_BACKEND);
        }
        if (solver == null) {
            throw new IllegalStateException("No OR-Tools mixed-integer backend available for " + backend);
        }
        return solver;
    }

    private static MPVariable[] load(MPSolver solver, IntegerProgram program) {
        MPVariable[] variables = new MPVariable[program.getVariableCount()];
        for (int v = 0; v < variables.length; v++) {
            variables[v] = solver.makeBoolVar("x" + v);
        }
        double infinity = MPSolver.infinity();
        for (ProgramRow row : program.getRows()) {
            MPConstraint constraint = solver.makeConstraint(
                    Math.max(row.lower(), -infinity), Math.min(row.upper(), infinity));
            double[] coefficients = row.coefficients();
            for (int v = 0; v < coefficients.length; v++) {
                if (coefficients[v] != 0.0) {
                    constraint.setCoefficient(variables[v], coefficients[v]);
                }
            }
        }
        MPObjective objective = solver.objective();
        double[] values = program.getObjective();
        for (int v = 0; v < values.length; v++) {
            objective.setCoefficient(variables[v], values[v]);
        }
        objective.setMaximization();
        return variables;
    }
}
