package com.dfsoptimizer.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One player record as supplied by a projection feed. Range checks that need more than one
 * field (floor <= projection <= ceiling) are done when the pool is loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerRequest {

    @NotBlank
    private String id;

    @NotBlank
    private String name;

    /** Roster positions (e.g. ["RB"], or ["RB", "WR"] for a multi-eligible player). */
    @NotEmpty
    private List<String> positions;

    @NotBlank
    private String team;

    private String opponent;
    private String gameId;

    @NotNull
    @Positive
    private Integer salary;

    @NotNull
    private Double projection;

    private Double floor;
    private Double ceiling;
    private Double stdDev;

    /** Projected ownership as a fraction in [0, 1]. */
    private double ownership;

    private boolean locked;
    private boolean banned;

    /** Percent boost applied to the projection (10 = +10%). */
    private double projectionBoost;

    private Double customProjection;
    private Double ownershipOverride;
    private Double minExposure;
    private Double maxExposure;
    private List<Double> historicalScores;
}
