package com.dfsoptimizer.pool;

import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlot;
import com.dfsoptimizer.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated, read-only view of the player universe for one optimization run.
 *
 * <p>Players keep their load order; {@link #indexOf(String)} gives the stable index used by the
 * correlation matrix and the simulator. The pool is never mutated after {@link #load(List)},
 * so it is safe to share across worker threads without locking.
 */
public final class PlayerPool {

    private final List<Player> players;
    private final Map<String, Integer> indexById;

    private PlayerPool(List<Player> players) {
        this.players = List.copyOf(players);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.players.size(); i++) {
            index.put(this.players.get(i).getId(), i);
        }
        this.indexById = Collections.unmodifiableMap(index);
    }

    /**
     * Validates every record and builds the pool.
     *
     * @throws ValidationException listing every offending player id, keyed by problem
     */
    public static PlayerPool load(List<Player> players) {
        if (players == null || players.isEmpty()) {
            throw new ValidationException("Player pool must not be empty");
        }
        Map<String, Object> problems = new LinkedHashMap<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Player player : players) {
            String id = player.getId();
            if (id == null || id.isBlank()) {
                problems.put("player[" + player.getName() + "]", "missing id");
                continue;
            }
            if (!seen.add(id)) {
                problems.put(id, "duplicate id");
                continue;
            }
            String problem = PlayerValidator.validate(player);
            if (problem != null) {
                problems.put(id, problem);
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid player pool: " + problems.size() + " bad record(s)", problems);
        }
        return new PlayerPool(players);
    }

    /** Players whose positions intersect the slot's eligible positions, banned players excluded. */
    public List<Player> eligibleForSlot(RosterSlot slot) {
        List<Player> eligible = new ArrayList<>();
        for (Player player : players) {
            if (!player.isBanned() && slot.accepts(player)) {
                eligible.add(player);
            }
        }
        return eligible;
    }

    public List<Player> getPlayers() {
        return players;
    }

    public int size() {
        return players.size();
    }

    public Player get(int index) {
        return players.get(index);
    }

    public Player getById(String id) {
        Integer index = indexById.get(id);
        if (index == null) {
            throw new ValidationException("Unknown player id: " + id);
        }
        return players.get(index);
    }

    public boolean contains(String id) {
        return indexById.containsKey(id);
    }

    /** Stable index of the player, or -1 when the id is not in the pool. */
    public int indexOf(String id) {
        return indexById.getOrDefault(id, -1);
    }

    public Set<String> getTeams() {
        Set<String> teams = new LinkedHashSet<>();
        players.forEach(p -> teams.add(p.getTeam()));
        return teams;
    }

    public Set<String> getGames() {
        Set<String> games = new LinkedHashSet<>();
        players.stream().filter(p -> !p.isBanned()).forEach(p -> games.add(p.getResolvedGameId()));
        return games;
    }
}
