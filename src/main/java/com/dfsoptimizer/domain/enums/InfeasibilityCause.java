package com.dfsoptimizer.domain.enums;

/**
 * Constraint class blamed for an infeasible lineup solve. UNKNOWN when the solver proves
 * infeasibility without a single identifiable culprit.
 */
public enum InfeasibilityCause {
    SALARY_CAP,
    SALARY_FLOOR,
    LOCKED_PLAYERS,
    ROSTER_SLOTS,
    TEAM_LIMIT,
    STACK_RULE,
    GAME_DIVERSITY,
    UNIQUENESS,
    UNKNOWN
}
