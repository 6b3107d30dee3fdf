package com.dfsoptimizer.constraint;

import lombok.Builder;
import lombok.Getter;

/**
 * A single broken roster rule found while checking a lineup candidate.
 *
 * <p>Codes are machine-readable: SALARY_CAP_EXCEEDED, SLOT_INELIGIBLE, STACK_MIN_NOT_MET, etc.
 */
@Getter
@Builder
public class ConstraintViolation {

    public static final String SALARY_CAP_EXCEEDED = "SALARY_CAP_EXCEEDED";
    public static final String SALARY_FLOOR_NOT_MET = "SALARY_FLOOR_NOT_MET";
    public static final String SLOT_EMPTY = "SLOT_EMPTY";
    public static final String SLOT_INELIGIBLE = "SLOT_INELIGIBLE";
    public static final String DUPLICATE_PLAYER = "DUPLICATE_PLAYER";
    public static final String UNKNOWN_PLAYER = "UNKNOWN_PLAYER";
    public static final String BANNED_PLAYER = "BANNED_PLAYER";
    public static final String LOCKED_PLAYER_MISSING = "LOCKED_PLAYER_MISSING";
    public static final String TEAM_LIMIT_EXCEEDED = "TEAM_LIMIT_EXCEEDED";
    public static final String STACK_MIN_NOT_MET = "STACK_MIN_NOT_MET";
    public static final String STACK_MAX_EXCEEDED = "STACK_MAX_EXCEEDED";
    public static final String BRING_BACK_NOT_MET = "BRING_BACK_NOT_MET";
    public static final String MIN_GAMES_NOT_MET = "MIN_GAMES_NOT_MET";
    public static final String UNIQUENESS_VIOLATED = "UNIQUENESS_VIOLATED";

    private final String code;
    private final String message;

    public static ConstraintViolation of(String code, String message) {
        return ConstraintViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
