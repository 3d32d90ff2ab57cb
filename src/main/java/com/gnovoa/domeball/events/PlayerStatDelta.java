package com.gnovoa.domeball.events;

import com.gnovoa.domeball.model.TeamSide;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** What one play changed in one player's match statistics. */
public record PlayerStatDelta(String playerId, TeamSide side, Map<MatchStat, Integer> changes) {

    public PlayerStatDelta {
        EnumMap<MatchStat, Integer> copy = new EnumMap<>(MatchStat.class);
        if (changes != null) copy.putAll(changes);
        changes = Collections.unmodifiableMap(copy);
    }

    public int get(MatchStat stat) {
        return changes.getOrDefault(stat, 0);
    }
}
