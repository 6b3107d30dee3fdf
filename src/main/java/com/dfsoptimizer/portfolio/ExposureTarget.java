package com.dfsoptimizer.portfolio;

import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.exception.ValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Allowed appearance rate of one player across the kept lineups, as fractions in [0, 1].
 * A null bound is not enforced.
 */
@Getter
@Builder
public class ExposureTarget {

    private final String playerId;
    private final Double minExposure;
    private final Double maxExposure;

    public static ExposureTarget of(String playerId, Double minExposure, Double maxExposure) {
        return ExposureTarget.builder()
                .playerId(playerId)
                .minExposure(minExposure)
                .maxExposure(maxExposure)
                .build();
    }

    void validate() {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("Exposure target needs a player id");
        }
        if (minExposure != null && (minExposure < 0 || minExposure > 1)) {
            throw new ValidationException("Min exposure for " + playerId + " must lie in [0, 1], was " + minExposure);
        }
        if (maxExposure != null && (maxExposure < 0 || maxExposure > 1)) {
            throw new ValidationException("Max exposure for " + playerId + " must lie in [0, 1], was " + maxExposure);
        }
        if (minExposure != null && maxExposure != null && minExposure > maxExposure) {
            throw new ValidationException("Min exposure above max exposure for " + playerId);
        }
    }

    /** Most lineups out of {@code lineupCount} that may contain the player, one lineup of rounding slack. */
    int maxCount(int lineupCount) {
        return maxExposure == null ? lineupCount : (int) Math.ceil(maxExposure * lineupCount - 1e-9);
    }

    /** Fewest lineups out of {@code lineupCount} that must contain the player, one lineup of rounding slack. */
    int minCount(int lineupCount) {
        return minExposure == null ? 0 : (int) Math.floor(minExposure * lineupCount + 1e-9);
    }

    /**
     * Targets declared on the players themselves, overridden by explicit targets for the same id.
     */
    public static List<ExposureTarget> merge(List<Player> players, List<ExposureTarget> explicit) {
        Map<String, ExposureTarget> byId = new LinkedHashMap<>();
        for (Player player : players) {
            if (player.getMinExposure() != null || player.getMaxExposure() != null) {
                byId.put(player.getId(), of(player.getId(), player.getMinExposure(), player.getMaxExposure()));
            }
        }
        if (explicit != null) {
            explicit.forEach(t -> byId.put(t.getPlayerId(), t));
        }
        return new ArrayList<>(byId.values());
    }
}
