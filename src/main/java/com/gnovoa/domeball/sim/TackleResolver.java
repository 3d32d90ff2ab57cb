package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.core.TeamState;
import com.gnovoa.domeball.events.EventPriority;
import com.gnovoa.domeball.events.EventStats;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.MatchEventType;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.Play;
import com.gnovoa.domeball.model.Role;
import java.util.List;

/**
 * Defense-focused play: a defender goes after the ball carrier and may knock the ball loose.
 *
 * <p>Forced-fumble chance is {@code fumbleBase + (tackler power - carrier power) / 2} percentage
 * points, clamped to the configured bounds. Without a fumble the carrier is wrapped up for
 * {@code floor(roll*3)} yards.
 */
public final class TackleResolver implements ActionResolver {

    private final BalanceConfig.Tackle config;
    private final EffectiveStatsCalculator calculator;
    private final LooseBallResolver looseBall;

    public TackleResolver(BalanceConfig.Tackle config, EffectiveStatsCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
        this.looseBall = new LooseBallResolver(calculator);
    }

    @Override
    public ActionType action() { return ActionType.DEFENSE; }

    @Override
    public MatchEvent resolve(MatchState state) {
        RandomSource rng = state.rng();
        TeamState offense = state.possessingTeam();
        TeamState defense = state.defendingTeam();

        PlayerState tackler = Participants.preferring(Role.BLOCKER, defense.onFieldPlayers(), rng);
        PlayerState carrier = Participants.preferring(Role.RUNNER, offense.onFieldPlayers(), rng);
        EffectiveStats tacklerStats = calculator.calculate(tackler);
        EffectiveStats carrierStats = calculator.calculate(carrier);

        boolean highPower = tacklerStats.power() > config.highPowerThreshold();
        double fumbleChance = config.fumbleBase() + (tacklerStats.power() - carrierStats.power()) / 2;
        fumbleChance = Math.max(config.minFumbleChance(), Math.min(config.maxFumbleChance(), fumbleChance));

        StatDeltas deltas = new StatDeltas()
                .add(tackler, MatchStat.PLAYS, 1)
                .add(tackler, MatchStat.TACKLES, 1);

        if (rng.nextDouble() * 100 < fumbleChance) {
            Play.LooseBall loose = looseBall.scramble(state, carrier, Play.LooseBallCause.TACKLE, deltas);
            return state.draftEvent(
                    loose.turnover() ? MatchEventType.TURNOVER : MatchEventType.ROUTINE_PLAY,
                    EventPriority.IMPORTANT,
                    List.of(tackler.id(), carrier.id(), loose.recoveredById()),
                    new Play.Tackle(tackler.id(), carrier.id(), 0, highPower, loose),
                    new EventStats(deltas.build(), loose.turnover(), false));
        }

        int yards = (int) Math.floor(rng.nextDouble() * 3);
        deltas.add(carrier, MatchStat.RUSHING_ATTEMPTS, 1)
                .add(carrier, MatchStat.RUSHING_YARDS, yards);

        return state.draftEvent(
                MatchEventType.ROUTINE_PLAY,
                EventPriority.STANDARD,
                List.of(tackler.id(), carrier.id()),
                new Play.Tackle(tackler.id(), carrier.id(), yards, highPower, null),
                new EventStats(deltas.build(), false, false));
    }
}
