package com.gnovoa.domeball.core;

import com.gnovoa.domeball.commentary.CommentaryGenerator;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.MatchEventType;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.Play;
import com.gnovoa.domeball.model.TeamSide;
import com.gnovoa.domeball.sim.ActionResolver;
import com.gnovoa.domeball.sim.ActionSelector;
import com.gnovoa.domeball.sim.ActionType;
import com.gnovoa.domeball.sim.BalanceConfig;
import com.gnovoa.domeball.sim.StaminaUpdater;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-based tick loop for one match.
 *
 * <p>Each {@link #simulateTick()} resolves exactly one action:
 * <ol>
 *   <li>update the phase from elapsed time</li>
 *   <li>select the action</li>
 *   <li>resolve it into a structured event</li>
 *   <li>apply stat deltas, score and possession</li>
 *   <li>drain stamina</li>
 *   <li>advance the clock by the event's priority</li>
 *   <li>render commentary</li>
 * </ol>
 *
 * <p>There is no timer or background thread: the caller keeps calling until {@link #isFinished()}.
 * Stopping early leaves {@link #state()} consistent.
 */
public final class MatchEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchEngine.class);

    private final MatchState state;
    private final ActionSelector selector;
    private final Map<ActionType, ActionResolver> resolvers;
    private final StaminaUpdater staminaUpdater;
    private final BalanceConfig.Clock clock;
    private final CommentaryGenerator commentary;

    MatchEngine(
            MatchState state,
            ActionSelector selector,
            Map<ActionType, ActionResolver> resolvers,
            StaminaUpdater staminaUpdater,
            BalanceConfig.Clock clock,
            CommentaryGenerator commentary) {
        this.state = state;
        this.selector = selector;
        this.resolvers = resolvers;
        this.staminaUpdater = staminaUpdater;
        this.clock = clock;
        this.commentary = commentary;
    }

    public String matchId() { return state.matchId(); }
    public MatchState state() { return state; }
    public boolean isFinished() { return state.isFinished(); }

    /**
     * Resolves one tick.
     *
     * @return the event of this tick, with clock snapshot and description filled in
     * @throws IllegalStateException if the match has already reached its duration
     */
    public MatchEvent simulateTick() {
        if (state.isFinished()) {
            throw new IllegalStateException("Match " + state.matchId() + " is already finished");
        }

        state.updatePhase();
        TeamSide offense = state.possession();

        ActionType action = selector.select(state);
        MatchEvent event = resolvers.get(action).resolve(state);

        apply(event, offense);
        staminaUpdater.update(state);
        state.advanceClock(clock.secondsFor(event.priority()), offense);

        event = event.withClock(state.snapshot());
        event = event.withDescription(commentary.describe(event, state));

        if (log.isDebugEnabled()) {
            log.debug("[{}] tick {} {} {} {}s: {}", state.matchId(), event.tick(), action, event.type(),
                    state.gameTime(), event.description());
        }
        if (state.isFinished()) {
            log.info("Match {} finished {}-{} after {} ticks", state.matchId(),
                    state.score(TeamSide.HOME), state.score(TeamSide.AWAY), state.tick());
        }
        return event;
    }

    /** Detached read-out of the current statistics; valid at any point of the match. */
    public MatchResult result() {
        Map<String, Map<MatchStat, Integer>> players = new LinkedHashMap<>();
        for (TeamSide side : TeamSide.values()) {
            state.team(side).players().values().forEach(p -> players.put(p.id(), p.stats().snapshot()));
        }
        return new MatchResult(
                state.matchId(),
                state.tick(),
                state.gameTime(),
                state.home().stats(state.score(TeamSide.HOME), state.possessionSeconds(TeamSide.HOME)),
                state.away().stats(state.score(TeamSide.AWAY), state.possessionSeconds(TeamSide.AWAY)),
                players);
    }

    private void apply(MatchEvent event, TeamSide offense) {
        event.stats().playerStats().forEach(state::applyDelta);

        if (event.type() == MatchEventType.SCORE) {
            state.recordScore(offense);
            state.switchPossession();
        } else if (event.stats().turnover() || event.stats().possessionChange()) {
            state.switchPossession();
        }

        move(event.play(), offense);
    }

    private void move(Play play, TeamSide offense) {
        double direction = offense == TeamSide.HOME ? 1 : -1;
        PlayerState mover = null;
        int yards = 0;
        if (play instanceof Play.Run run) {
            mover = state.player(run.carrierId());
            yards = run.yards();
        } else if (play instanceof Play.Pass pass && pass.outcome() == Play.PassOutcome.COMPLETE) {
            mover = state.player(pass.receiverId());
            yards = pass.yards();
        } else if (play instanceof Play.Tackle tackle && !tackle.forcedFumble()) {
            mover = state.player(tackle.carrierId());
            yards = tackle.yards();
        }
        if (mover != null && yards > 0) {
            mover.moveTo(mover.position().advance(direction * yards));
        }
    }
}
