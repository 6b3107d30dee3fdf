package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import java.util.Arrays;
import java.util.List;

/**
 * Bipartite matching of selected players onto roster slots (augmenting paths).
 *
 * <p>Used twice: to check that a lock set can be seated at all, and to seat the player set a
 * solve selects. Flex slots make a greedy fill unsafe, a RB taking FLEX can leave the RB slot empty.
 */
final class SlotAssigner {

    private SlotAssigner() {}

    /**
     * Seats every player in a distinct eligible slot. When fewer players than slots are given,
     * the remaining slots stay null.
     *
     * @return players indexed by slot, or null when no matching covers every player
     */
    static Player[] assign(List<Player> players, RosterSlotSpec slotSpec) {
        int slotCount = slotSpec.getRosterSize();
        if (players.size() > slotCount) {
            return null;
        }
        int[] slotOwner = new int[slotCount];
        Arrays.fill(slotOwner, -1);
        for (int p = 0; p < players.size(); p++) {
            if (!augment(p, players, slotSpec, slotOwner, new boolean[slotCount])) {
                return null;
            }
        }
        Player[] seated = new Player[slotCount];
        for (int s = 0; s < slotCount; s++) {
            if (slotOwner[s] >= 0) {
                seated[s] = players.get(slotOwner[s]);
            }
        }
        return seated;
    }

    private static boolean augment(
            int player, List<Player> players, RosterSlotSpec slotSpec, int[] slotOwner, boolean[] visited) {
        for (int s = 0; s < slotOwner.length; s++) {
            if (visited[s] || !slotSpec.getSlot(s).accepts(players.get(player))) {
                continue;
            }
            visited[s] = true;
            if (slotOwner[s] < 0 || augment(slotOwner[s], players, slotSpec, slotOwner, visited)) {
                slotOwner[s] = player;
                return true;
            }
        }
        return false;
    }
}
