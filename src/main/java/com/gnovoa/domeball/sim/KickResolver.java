package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.events.EventPriority;
import com.gnovoa.domeball.events.EventStats;
import com.gnovoa.domeball.events.MatchEvent;
import com.gnovoa.domeball.events.MatchEventType;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.Play;
import java.util.List;

/**
 * Kick by the on-field player with the best effective kicking (lineup order breaks ties). A kick
 * that does not score hands the ball to the other side.
 */
public final class KickResolver implements ActionResolver {

    private final BalanceConfig.Kick config;
    private final EffectiveStatsCalculator calculator;

    public KickResolver(BalanceConfig.Kick config, EffectiveStatsCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
    }

    @Override
    public ActionType action() { return ActionType.KICK; }

    @Override
    public MatchEvent resolve(MatchState state) {
        RandomSource rng = state.rng();

        PlayerState kicker = null;
        double bestKicking = Double.NEGATIVE_INFINITY;
        for (PlayerState p : state.possessingTeam().onFieldPlayers()) {
            double kicking = calculator.calculate(p).kicking();
            if (kicking > bestKicking) {
                bestKicking = kicking;
                kicker = p;
            }
        }

        int yards = Math.max(0, (int) Math.floor(10 + bestKicking / 2 + rng.nextDouble() * 15));
        boolean score = rng.nextDouble() < bestKicking / config.scoreDivisor();

        StatDeltas deltas = new StatDeltas()
                .add(kicker, MatchStat.PLAYS, 1)
                .add(kicker, MatchStat.KICKS, 1)
                .add(kicker, MatchStat.KICKING_YARDS, yards)
                .addIf(score, kicker, MatchStat.SCORES, 1);

        return state.draftEvent(
                score ? MatchEventType.SCORE : MatchEventType.ROUTINE_PLAY,
                score ? EventPriority.CRITICAL : EventPriority.DOWNTIME,
                List.of(kicker.id()),
                new Play.Kick(kicker.id(), yards, score),
                new EventStats(deltas.build(), false, !score));
    }
}
