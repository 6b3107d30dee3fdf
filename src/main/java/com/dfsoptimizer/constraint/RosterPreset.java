package com.dfsoptimizer.constraint;

import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.exception.ValidationException;
import java.util.Arrays;
import java.util.List;
import lombok.Getter;

/**
 * Fixed slot layouts and default salary caps per site/sport combination.
 */
@Getter
public enum RosterPreset {
    DK_NFL_CLASSIC(
            "DraftKings",
            "NFL",
            50_000,
            List.of(
                    RosterSlot.of("QB"),
                    RosterSlot.of("RB"),
                    RosterSlot.of("RB"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("TE"),
                    RosterSlot.flex("FLEX", "RB", "WR", "TE"),
                    RosterSlot.of("DST"))),
    FD_NFL_CLASSIC(
            "FanDuel",
            "NFL",
            60_000,
            List.of(
                    RosterSlot.of("QB"),
                    RosterSlot.of("RB"),
                    RosterSlot.of("RB"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("WR"),
                    RosterSlot.of("TE"),
                    RosterSlot.flex("FLEX", "RB", "WR", "TE"),
                    RosterSlot.of("DEF"))),
    DK_NBA_CLASSIC(
            "DraftKings",
            "NBA",
            50_000,
            List.of(
                    RosterSlot.of("PG"),
                    RosterSlot.of("SG"),
                    RosterSlot.of("SF"),
                    RosterSlot.of("PF"),
                    RosterSlot.of("C"),
                    RosterSlot.flex("G", "PG", "SG"),
                    RosterSlot.flex("F", "SF", "PF"),
                    RosterSlot.flex("UTIL", "PG", "SG", "SF", "PF", "C")));

    private final String site;
    private final String sport;
    private final int defaultSalaryCap;
    private final List<RosterSlot> slots;

    RosterPreset(String site, String sport, int defaultSalaryCap, List<RosterSlot> slots) {
        this.site = site;
        this.sport = sport;
        this.defaultSalaryCap = defaultSalaryCap;
        this.slots = slots;
    }

    public RosterSlotSpec slotSpec() {
        return RosterSlotSpec.of(slots);
    }

    /**
     * Resolves the salary cap for this preset. An override may lower the cap but never raise it
     * above the site's cap.
     */
    public int resolveSalaryCap(Integer override) {
        if (override == null) {
            return defaultSalaryCap;
        }
        if (override <= 0) {
            throw new ValidationException("Salary cap override must be positive, was " + override);
        }
        if (override > defaultSalaryCap) {
            throw new ValidationException(
                    "Salary cap override " + override + " exceeds maximum " + defaultSalaryCap + " for " + name());
        }
        return override;
    }

    public static RosterPreset fromName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new ValidationException("Unknown roster preset: " + name));
    }
}
