package com.dfsoptimizer.domain.enums;

/** Why a batch delivered fewer lineups than requested. */
public enum BatchStopReason {
    NONE,
    INFEASIBLE,
    TIMEOUT,
    CANCELLED
}
