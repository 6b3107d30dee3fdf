package com.dfsoptimizer.simulation;

import com.dfsoptimizer.domain.enums.ContestType;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Contest payout tiers as multiples of the entry fee, by finishing rank (1 = winner).
 *
 * <p>GPP: top-heavy, roughly the top 20% paid, first place 1000x scaled down for small fields.
 * CASH: double-up style, the top 45% paid 1.8x.
 */
@Getter
public final class PayoutStructure {

    /** Inclusive rank range paying {@code multiple} times the entry fee. */
    public record Tier(int fromRank, int toRank, double multiple) {}

    private final ContestType contestType;
    private final int fieldSize;
    private final List<Tier> tiers;

    private PayoutStructure(ContestType contestType, int fieldSize, List<Tier> tiers) {
        this.contestType = contestType;
        this.fieldSize = fieldSize;
        this.tiers = List.copyOf(tiers);
    }

    public static PayoutStructure of(ContestType contestType, int fieldSize) {
        return contestType == ContestType.CASH ? cash(fieldSize) : gpp(fieldSize);
    }

    public static PayoutStructure cash(int fieldSize) {
        int paid = Math.max(1, (int) Math.floor(fieldSize * 0.45));
        return new PayoutStructure(ContestType.CASH, fieldSize, List.of(new Tier(1, paid, 1.8)));
    }

    public static PayoutStructure gpp(int fieldSize) {
        // fraction of field (upper rank bound) -> multiple
        double[][] shape = {
            {0.0001, 1000.0},
            {0.0005, 100.0},
            {0.001, 40.0},
            {0.005, 15.0},
            {0.01, 8.0},
            {0.05, 4.0},
            {0.10, 2.5},
            {0.20, 1.5},
        };
        List<Tier> tiers = new ArrayList<>();
        int from = 1;
        for (double[] step : shape) {
            int to = Math.min(fieldSize, (int) Math.floor(fieldSize * step[0]));
            if (from == 1) {
                to = Math.max(to, 1);
            }
            if (to < from) {
                continue;
            }
            // small fields collapse the top tiers into first place, capped at the field's total buy-in
            double multiple = Math.max(Math.min(step[1], fieldSize * 0.2), 1.5);
            tiers.add(new Tier(from, to, multiple));
            from = to + 1;
        }
        return new PayoutStructure(ContestType.GPP, fieldSize, tiers);
    }

    /** Payout multiple for a possibly fractional expected rank; 0 outside the paid range. */
    public double multipleAt(double rank) {
        int whole = (int) Math.max(1, Math.round(rank));
        for (Tier tier : tiers) {
            if (whole >= tier.fromRank() && whole <= tier.toRank()) {
                return tier.multiple();
            }
        }
        return 0.0;
    }

    public int getPaidPositions() {
        return tiers.isEmpty() ? 0 : tiers.get(tiers.size() - 1).toRank();
    }
}
