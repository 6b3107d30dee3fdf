package com.dfsoptimizer.optimizer;

import com.dfsoptimizer.domain.model.Player;
import com.dfsoptimizer.domain.model.RosterSlotSpec;
import com.dfsoptimizer.pool.PlayerPool;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * An {@link IntegerProgram} for one lineup solve together with the mapping from its selection
 * variables back to pool players.
 */
@Getter
public final class LineupProgram {

    private static final double SELECTED = 0.5;

    private final IntegerProgram program;
    private final PlayerPool pool;
    private final RosterSlotSpec slotSpec;

    /** Pool index of the player behind each selection variable; -1 for auxiliary variables. */
    private final int[] variablePlayer;

    LineupProgram(IntegerProgram program, PlayerPool pool, RosterSlotSpec slotSpec, int[] variablePlayer) {
        this.program = program;
        this.pool = pool;
        this.slotSpec = slotSpec;
        this.variablePlayer = variablePlayer;
    }

    /**
     * Seats the selected players by matching them onto slots.
     *
     * @return players by slot, or null when the selection is not a full seatable roster
     */
    Player[] decode(IntegerSolution solution) {
        double[] values = solution.values();
        List<Player> selected = new ArrayList<>();
        for (int v = 0; v < variablePlayer.length; v++) {
            if (variablePlayer[v] >= 0 && values[v] > SELECTED) {
                selected.add(pool.get(variablePlayer[v]));
            }
        }
        if (selected.size() != slotSpec.getRosterSize()) {
            return null;
        }
        return SlotAssigner.assign(selected, slotSpec);
    }
}
