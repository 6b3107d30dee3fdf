package com.dfsoptimizer.domain.enums;

/**
 * Why two player outcomes move together. Generated entries carry one of the stack tags;
 * caller-supplied entries default to MANUAL.
 */
public enum CorrelationReason {
    QB_PASS_CATCHER,
    QB_RUNNING_BACK,
    RB_OWN_DEFENSE,
    TEAMMATE_PASS_CATCHERS,
    BRING_BACK,
    RB_VS_OPPOSING_DEFENSE,
    QB_VS_OPPOSING_DEFENSE,
    GAME_ENVIRONMENT,
    MANUAL
}
