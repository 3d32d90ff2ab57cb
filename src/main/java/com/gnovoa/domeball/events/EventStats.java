package com.gnovoa.domeball.events;

import java.util.List;

/**
 * Structured payload of an event: per-player deltas plus the possession outcome.
 *
 * @param turnover the defense took the ball
 * @param possessionChange the ball changes sides without a turnover (a kick)
 */
public record EventStats(List<PlayerStatDelta> playerStats, boolean turnover, boolean possessionChange) {

    public EventStats {
        playerStats = playerStats == null ? List.of() : List.copyOf(playerStats);
    }

    public int total(MatchStat stat) {
        return playerStats.stream().mapToInt(d -> d.get(stat)).sum();
    }
}
