package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.model.Role;
import java.util.List;
import java.util.function.ToDoubleFunction;

/** Actor selection shared by the resolvers. */
final class Participants {

    private Participants() {}

    /**
     * Picks a player with the preferred role; when none is available, any candidate. Either way
     * exactly one RNG value is consumed.
     */
    static PlayerState preferring(Role role, List<PlayerState> candidates, RandomSource rng) {
        List<PlayerState> preferred = candidates.stream().filter(p -> p.role() == role).toList();
        return preferred.isEmpty() ? rng.choice(candidates) : rng.choice(preferred);
    }

    /** Arithmetic mean of a per-player value, summed in lineup order. */
    static double average(List<PlayerState> players, ToDoubleFunction<PlayerState> value) {
        double sum = 0;
        for (PlayerState p : players) {
            sum += value.applyAsDouble(p);
        }
        return sum / players.size();
    }
}
