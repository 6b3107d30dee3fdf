package com.dfsoptimizer.correlation;

import com.dfsoptimizer.domain.enums.CorrelationReason;
import com.dfsoptimizer.domain.model.CorrelationEntry;
import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.exception.ValidationException;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives heuristic NFL correlation entries from team/opponent affiliation.
 *
 * <p>Base coefficients (scaled by {@code strength} in [0, 1]):
 * <ul>
 *   <li>QB + same-team WR: +0.70, QB + same-team TE: +0.60, QB + same-team RB: +0.20</li>
 *   <li>RB + own DST: +0.20, same-team WR/TE pair: +0.15</li>
 *   <li>QB + opposing WR/TE (bring-back): +0.30</li>
 *   <li>RB vs opposing DST: -0.35, QB vs opposing DST: -0.40</li>
 * </ul>
 *
 * <p>The coefficients are placeholders to be calibrated against historical data. The output is
 * a plain entry list; the matrix builder still runs its PSD correction on the combined input.
 */
@Component
public class CorrelationRuleGenerator {

    private static final Logger log = LoggerFactory.getLogger(CorrelationRuleGenerator.class);

    static final double QB_WR = 0.70;
    static final double QB_TE = 0.60;
    static final double QB_RB = 0.20;
    static final double RB_OWN_DST = 0.20;
    static final double TEAMMATE_PASS_CATCHERS = 0.15;
    static final double BRING_BACK = 0.30;
    static final double RB_VS_DST = -0.35;
    static final double QB_VS_DST = -0.40;

    private static final Set<String> DEFENSE = Set.of("DST", "DEF", "D");
    private static final Set<String> PASS_CATCHERS = Set.of("WR", "TE");

    public List<CorrelationEntry> generate(PlayerPool pool, double strength) {
        if (!Double.isFinite(strength) || strength < 0.0 || strength > 1.0) {
            throw new ValidationException("Correlation strength must lie in [0, 1], was " + strength);
        }
        List<CorrelationEntry> entries = new ArrayList<>();
        if (strength == 0.0) {
            return entries;
        }
        List<Player> players = pool.getPlayers();
        for (int i = 0; i < players.size(); i++) {
            for (int j = i + 1; j < players.size(); j++) {
                Player a = players.get(i);
                Player b = players.get(j);
                CorrelationEntry entry = pairRule(a, b, strength);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        }
        log.debug("Generated {} rule-based correlation entries at strength {}", entries.size(), strength);
        return entries;
    }

    /**
     * Combines generated and explicit entries. An explicit entry replaces a generated one for the
     * same unordered pair.
     */
    public List<CorrelationEntry> merge(List<CorrelationEntry> generated, List<CorrelationEntry> explicit) {
        Map<String, CorrelationEntry> byPair = new LinkedHashMap<>();
        if (generated != null) {
            generated.forEach(e -> byPair.put(pairKey(e), e));
        }
        if (explicit != null) {
            explicit.forEach(e -> byPair.put(pairKey(e), e));
        }
        return new ArrayList<>(byPair.values());
    }

    private CorrelationEntry pairRule(Player a, Player b, double strength) {
        if (a.getTeam().equals(b.getTeam())) {
            return sameTeamRule(a, b, strength);
        }
        if (isOpponent(a, b)) {
            return opposingRule(a, b, strength);
        }
        return null;
    }

    private CorrelationEntry sameTeamRule(Player a, Player b, double strength) {
        Player qb = pick(a, b, "QB");
        if (qb != null) {
            Player other = qb == a ? b : a;
            if (other.hasPosition("WR")) {
                return entry(a, b, QB_WR * strength, CorrelationReason.QB_PASS_CATCHER);
            }
            if (other.hasPosition("TE")) {
                return entry(a, b, QB_TE * strength, CorrelationReason.QB_PASS_CATCHER);
            }
            if (other.hasPosition("RB")) {
                return entry(a, b, QB_RB * strength, CorrelationReason.QB_RUNNING_BACK);
            }
            return null;
        }
        if ((a.hasPosition("RB") && isDefense(b)) || (b.hasPosition("RB") && isDefense(a))) {
            return entry(a, b, RB_OWN_DST * strength, CorrelationReason.RB_OWN_DEFENSE);
        }
        if (isPassCatcher(a) && isPassCatcher(b)) {
            return entry(a, b, TEAMMATE_PASS_CATCHERS * strength, CorrelationReason.TEAMMATE_PASS_CATCHERS);
        }
        return null;
    }

    private CorrelationEntry opposingRule(Player a, Player b, double strength) {
        Player qb = pick(a, b, "QB");
        if (qb != null) {
            Player other = qb == a ? b : a;
            if (isDefense(other)) {
                return entry(a, b, QB_VS_DST * strength, CorrelationReason.QB_VS_OPPOSING_DEFENSE);
            }
            if (isPassCatcher(other)) {
                return entry(a, b, BRING_BACK * strength, CorrelationReason.BRING_BACK);
            }
            return null;
        }
        if ((a.hasPosition("RB") && isDefense(b)) || (b.hasPosition("RB") && isDefense(a))) {
            return entry(a, b, RB_VS_DST * strength, CorrelationReason.RB_VS_OPPOSING_DEFENSE);
        }
        return null;
    }

    private static Player pick(Player a, Player b, String position) {
        if (a.hasPosition(position)) {
            return a;
        }
        if (b.hasPosition(position)) {
            return b;
        }
        return null;
    }

    private static boolean isOpponent(Player a, Player b) {
        return b.getTeam().equals(a.getOpponent()) || a.getTeam().equals(b.getOpponent());
    }

    private static boolean isDefense(Player player) {
        return player.getPositions().stream().anyMatch(DEFENSE::contains);
    }

    private static boolean isPassCatcher(Player player) {
        return player.getPositions().stream().anyMatch(PASS_CATCHERS::contains);
    }

    private static CorrelationEntry entry(Player a, Player b, double coefficient, CorrelationReason reason) {
        return CorrelationEntry.of(a.getId(), b.getId(), coefficient, reason);
    }

    private static String pairKey(CorrelationEntry entry) {
        String a = entry.getPlayerA();
        String b = entry.getPlayerB();
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
