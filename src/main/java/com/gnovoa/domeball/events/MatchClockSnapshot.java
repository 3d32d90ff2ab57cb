package com.gnovoa.domeball.events;

import com.gnovoa.domeball.model.TeamSide;

/** Clock, phase, score and possession as they stand after an event was applied. */
public record MatchClockSnapshot(
        String phase,
        int gameTime,
        int maxTime,
        int homeScore,
        int awayScore,
        TeamSide possession
) {}
