package com.gnovoa.domeball.events;

/** Counters accumulated per player over a match. */
public enum MatchStat {
    /** One per tick, credited to the primary actor of the play. */
    PLAYS,
    RUSHING_ATTEMPTS,
    RUSHING_YARDS,
    BREAKAWAY_RUNS,
    PASS_ATTEMPTS,
    PASS_COMPLETIONS,
    PASSING_YARDS,
    CATCHES,
    RECEIVING_YARDS,
    DROPS,
    /** Drops the defense recovered. */
    DROPS_LOST,
    KICKS,
    KICKING_YARDS,
    TACKLES,
    INTERCEPTIONS,
    INTERCEPTIONS_THROWN,
    /** Tackle-forced fumbles the defense recovered. */
    FUMBLES_LOST,
    FUMBLE_RECOVERIES,
    SCORES
}
