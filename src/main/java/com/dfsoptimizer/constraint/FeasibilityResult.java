package com.dfsoptimizer.constraint;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of checking a lineup candidate against a {@link ConstraintSet}. Either feasible
 * (no violations) or infeasible with every violation found, not just the first.
 */
@Getter
public class FeasibilityResult {

    private static final FeasibilityResult FEASIBLE = new FeasibilityResult(true, Collections.emptyList());

    private final boolean feasible;
    private final List<ConstraintViolation> violations;

    private FeasibilityResult(boolean feasible, List<ConstraintViolation> violations) {
        this.feasible = feasible;
        this.violations = violations;
    }

    public static FeasibilityResult feasible() {
        return FEASIBLE;
    }

    public static FeasibilityResult infeasible(List<ConstraintViolation> violations) {
        return new FeasibilityResult(false, List.copyOf(violations));
    }

    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(v -> v.getCode().equals(code));
    }
}
