package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.PlayerStatDelta;
import com.gnovoa.domeball.model.TeamSide;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Collects per-player stat changes for one play, merging repeated entries for a player. */
final class StatDeltas {

    private final Map<String, TeamSide> sides = new LinkedHashMap<>();
    private final Map<String, EnumMap<MatchStat, Integer>> changes = new LinkedHashMap<>();

    StatDeltas add(PlayerState player, MatchStat stat, int amount) {
        sides.putIfAbsent(player.id(), player.side());
        changes.computeIfAbsent(player.id(), id -> new EnumMap<>(MatchStat.class)).merge(stat, amount, Integer::sum);
        return this;
    }

    StatDeltas addIf(boolean condition, PlayerState player, MatchStat stat, int amount) {
        return condition ? add(player, stat, amount) : this;
    }

    List<PlayerStatDelta> build() {
        List<PlayerStatDelta> out = new ArrayList<>(changes.size());
        changes.forEach((id, c) -> out.add(new PlayerStatDelta(id, sides.get(id), c)));
        return out;
    }
}
