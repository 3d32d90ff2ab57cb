package com.gnovoa.domeball.events;

import com.gnovoa.domeball.model.TeamSide;
import java.util.List;

/**
 * One tick of a match. Immutable and self-contained so it can be streamed or stored as is.
 *
 * @param tick zero-based tick index
 * @param gameTime game-clock second at which the play started
 * @param offense side in possession when the play started
 * @param description commentary text; empty until the commentary generator fills it
 * @param clock state after the event was applied
 */
public record MatchEvent(
        String id,
        String matchId,
        int tick,
        int gameTime,
        MatchEventType type,
        EventPriority priority,
        TeamSide offense,
        List<String> playersInvolved,
        String description,
        Play play,
        EventStats stats,
        MatchClockSnapshot clock
) {

    public MatchEvent {
        playersInvolved = playersInvolved == null ? List.of() : List.copyOf(playersInvolved);
        if (description == null) description = "";
    }

    public MatchEvent withDescription(String text) {
        return new MatchEvent(id, matchId, tick, gameTime, type, priority, offense, playersInvolved, text, play, stats, clock);
    }

    public MatchEvent withClock(MatchClockSnapshot snapshot) {
        return new MatchEvent(id, matchId, tick, gameTime, type, priority, offense, playersInvolved, description, play, stats, snapshot);
    }
}
