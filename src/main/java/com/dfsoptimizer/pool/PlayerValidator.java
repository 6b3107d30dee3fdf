package com.dfsoptimizer.pool;

import com.dfsoptimizer.domain.model.Player;

/**
 * Record-level checks for a single player. Returns a short problem description, or null when
 * the record is valid.
 */
final class PlayerValidator {

    private static final double EPSILON = 1e-9;

    private PlayerValidator() {}

    static String validate(Player player) {
        if (player.getSalary() <= 0) {
            return "salary must be positive, was " + player.getSalary();
        }
        if (player.getPositions() == null || player.getPositions().isEmpty()) {
            return "position set is empty";
        }
        if (player.getPositions().stream().anyMatch(p -> p == null || p.isBlank())) {
            return "position set contains a blank entry";
        }
        if (player.getTeam() == null || player.getTeam().isBlank()) {
            return "team is required";
        }
        if (!Double.isFinite(player.getProjection()) || player.getProjection() < 0) {
            return "projection must be a non-negative number";
        }
        double projection = player.getProjection();
        if (player.getFloor() != null && player.getFloor() > projection + EPSILON) {
            return "floor " + player.getFloor() + " exceeds projection " + projection;
        }
        if (player.getCeiling() != null && player.getCeiling() < projection - EPSILON) {
            return "ceiling " + player.getCeiling() + " is below projection " + projection;
        }
        if (player.getStdDev() != null && (!Double.isFinite(player.getStdDev()) || player.getStdDev() < 0)) {
            return "stdDev must be a non-negative number";
        }
        if (!isFraction(player.getOwnership())) {
            return "ownership must lie in [0, 1], was " + player.getOwnership();
        }
        if (player.getOwnershipOverride() != null && !isFraction(player.getOwnershipOverride())) {
            return "ownershipOverride must lie in [0, 1]";
        }
        if (player.isLocked() && player.isBanned()) {
            return "player is both locked and banned";
        }
        if (player.getMinExposure() != null && !isFraction(player.getMinExposure())) {
            return "minExposure must lie in [0, 1]";
        }
        if (player.getMaxExposure() != null && !isFraction(player.getMaxExposure())) {
            return "maxExposure must lie in [0, 1]";
        }
        if (player.getMinExposure() != null
                && player.getMaxExposure() != null
                && player.getMinExposure() > player.getMaxExposure()) {
            return "minExposure exceeds maxExposure";
        }
        if (player.getProjectionBoost() <= -100.0) {
            return "projectionBoost must be above -100%";
        }
        if (player.hasHistory() && player.getHistoricalScores().stream().anyMatch(v -> v == null || !Double.isFinite(v))) {
            return "historicalScores must be finite numbers";
        }
        return null;
    }

    private static boolean isFraction(double value) {
        return Double.isFinite(value) && value >= 0.0 && value <= 1.0;
    }
}
