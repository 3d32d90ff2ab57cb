package com.gnovoa.domeball.core;

import com.gnovoa.domeball.events.EventPriority;
import com.gnovoa.domeball.events.EventStats;
import com.gnovoa.domeball.events.MatchClockSnapshot;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.MatchEventType;
import com.gnovoa.domeball.events.Play;
import com.gnovoa.domeball.events.PlayerStatDelta;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.RandomSource;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory state for a single match.
 *
 * <p>This class owns:
 * <ul>
 *   <li>Both {@link TeamState}s and, through them, every {@link PlayerState}</li>
 *   <li>The game clock ({@code gameTime}/{@code maxTime}) and the derived {@link MatchPhase}</li>
 *   <li>Possession, score and time of possession</li>
 *   <li>The match's {@link RandomSource}; nothing else in the engine draws randomness</li>
 * </ul>
 *
 * <p>It is created once per match by {@link MatchEngineFactory}, mutated by {@link MatchEngine} on
 * every tick, and stays readable if the caller stops ticking early. Not thread-safe: a match is
 * simulated on one thread at a time.
 */
public final class MatchState {

    private final String matchId;
    private final TeamState home;
    private final TeamState away;
    private final RandomSource rng;
    private final int maxTime;

    private int gameTime = 0;
    private int tick = 0;
    private TeamSide possession = TeamSide.HOME;
    private MatchPhase phase = MatchPhase.EARLY;

    private final Map<TeamSide, Integer> score = new EnumMap<>(TeamSide.class);
    private final Map<TeamSide, Integer> possessionSeconds = new EnumMap<>(TeamSide.class);

    MatchState(String matchId, TeamState home, TeamState away, RandomSource rng, int maxTime) {
        this.matchId = matchId;
        this.home = home;
        this.away = away;
        this.rng = rng;
        this.maxTime = maxTime;
        for (TeamSide side : TeamSide.values()) {
            score.put(side, 0);
            possessionSeconds.put(side, 0);
        }
    }

    public String matchId() { return matchId; }
    public TeamState home() { return home; }
    public TeamState away() { return away; }
    public RandomSource rng() { return rng; }

    public int gameTime() { return gameTime; }
    public int maxTime() { return maxTime; }

    /** @return number of ticks resolved so far */
    public int tick() { return tick; }

    public MatchPhase phase() { return phase; }
    public TeamSide possession() { return possession; }

    /** @return true once the clock reached the match duration. */
    public boolean isFinished() { return gameTime >= maxTime; }

    public TeamState team(TeamSide side) {
        return side == TeamSide.HOME ? home : away;
    }

    public TeamState possessingTeam() { return team(possession); }
    public TeamState defendingTeam() { return team(possession.opposite()); }

    /**
     * Looks a player up on either side.
     *
     * @throws IllegalArgumentException if neither roster contains the id
     */
    public PlayerState player(String playerId) {
        if (home.hasPlayer(playerId)) return home.player(playerId);
        return away.player(playerId);
    }

    public int score(TeamSide side) { return score.get(side); }
    public int possessionSeconds(TeamSide side) { return possessionSeconds.get(side); }

    void updatePhase() {
        phase = MatchPhase.at(gameTime, maxTime);
    }

    void recordScore(TeamSide side) {
        score.merge(side, 1, Integer::sum);
    }

    void switchPossession() {
        possession = possession.opposite();
    }

    void applyDelta(PlayerStatDelta delta) {
        team(delta.side()).player(delta.playerId()).stats().apply(delta);
    }

    /**
     * Advances the clock and credits the elapsed time to the side that had the ball.
     *
     * @param seconds game seconds consumed by the tick, always positive
     * @param offense side in possession while the play ran
     */
    void advanceClock(int seconds, TeamSide offense) {
        gameTime += seconds;
        possessionSeconds.merge(offense, seconds, Integer::sum);
        tick++;
    }

    public MatchClockSnapshot snapshot() {
        return new MatchClockSnapshot(phase.name(), gameTime, maxTime, score(TeamSide.HOME), score(TeamSide.AWAY), possession);
    }

    /**
     * Creates an event for the current tick, stamped with the current clock. The description is
     * left empty for the commentary generator.
     */
    public MatchEvent draftEvent(MatchEventType type, EventPriority priority, List<String> playersInvolved,
                                 Play play, EventStats stats) {
        return new MatchEvent(
                "evt-" + matchId + "-" + tick,
                matchId,
                tick,
                gameTime,
                type,
                priority,
                possession,
                playersInvolved,
                "",
                play,
                stats,
                snapshot());
    }
}
