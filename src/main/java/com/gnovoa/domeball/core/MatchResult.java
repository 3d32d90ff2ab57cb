package com.gnovoa.domeball.core;

import com.gnovoa.domeball.events.MatchStat;
import java.util.Map;

/**
 * Final read-out of a match, detached from the mutable state.
 *
 * @param playerStats counters per player id
 */
public record MatchResult(
        String matchId,
        int ticks,
        int gameTime,
        TeamMatchStats home,
        TeamMatchStats away,
        Map<String, Map<MatchStat, Integer>> playerStats
) {

    public MatchResult {
        playerStats = Map.copyOf(playerStats);
    }

    public int homeScore() { return home.score(); }
    public int awayScore() { return away.score(); }
}
