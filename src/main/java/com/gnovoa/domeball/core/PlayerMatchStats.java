package com.gnovoa.domeball.core;

import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.PlayerStatDelta;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Running statistics of one player in one match. */
public final class PlayerMatchStats {

    private final String playerId;
    private final EnumMap<MatchStat, Integer> counters = new EnumMap<>(MatchStat.class);

    public PlayerMatchStats(String playerId) {
        this.playerId = playerId;
        for (MatchStat stat : MatchStat.values()) counters.put(stat, 0);
    }

    public String playerId() { return playerId; }

    public int get(MatchStat stat) {
        return counters.get(stat);
    }

    public int plays() { return get(MatchStat.PLAYS); }
    public int scores() { return get(MatchStat.SCORES); }
    public int rushingYards() { return get(MatchStat.RUSHING_YARDS); }
    public int tackles() { return get(MatchStat.TACKLES); }

    /** @return fumbles lost, drops lost and interceptions thrown */
    public int turnovers() {
        return get(MatchStat.FUMBLES_LOST) + get(MatchStat.DROPS_LOST) + get(MatchStat.INTERCEPTIONS_THROWN);
    }

    void apply(PlayerStatDelta delta) {
        delta.changes().forEach((stat, amount) -> counters.merge(stat, amount, Integer::sum));
    }

    /** @return immutable copy of all counters */
    public Map<MatchStat, Integer> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(counters));
    }
}
