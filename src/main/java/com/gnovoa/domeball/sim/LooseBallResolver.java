package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchState;
import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.events.MatchStat;
import com.gnovoa.domeball.events.Play;
import java.util.ArrayList;
import java.util.List;

/**
 * Scramble for a ball on the turf. All twelve on-field players compete, weighted by effective
 * agility (at least 1 each); one RNG draw picks who comes up with it.
 *
 * <p>A defensive recovery charges the fumbler with a lost fumble after a tackle, or a lost drop
 * after a dropped pass.
 */
final class LooseBallResolver {

    private final EffectiveStatsCalculator calculator;

    LooseBallResolver(EffectiveStatsCalculator calculator) {
        this.calculator = calculator;
    }

    Play.LooseBall scramble(MatchState state, PlayerState fumbler, Play.LooseBallCause cause, StatDeltas deltas) {
        List<PlayerState> contenders = new ArrayList<>(state.possessingTeam().onFieldPlayers());
        contenders.addAll(state.defendingTeam().onFieldPlayers());

        double[] weights = new double[contenders.size()];
        double total = 0;
        for (int i = 0; i < contenders.size(); i++) {
            weights[i] = Math.max(1, calculator.calculate(contenders.get(i)).agility());
            total += weights[i];
        }

        double r = state.rng().nextDouble() * total;
        PlayerState recoverer = contenders.get(contenders.size() - 1);
        for (int i = 0; i < contenders.size(); i++) {
            if (r < weights[i]) {
                recoverer = contenders.get(i);
                break;
            }
            r -= weights[i];
        }

        boolean turnover = recoverer.side() != state.possession();
        boolean drop = cause == Play.LooseBallCause.DROP;
        deltas.add(recoverer, MatchStat.FUMBLE_RECOVERIES, 1)
                .addIf(drop, fumbler, MatchStat.DROPS, 1)
                .addIf(drop && turnover, fumbler, MatchStat.DROPS_LOST, 1)
                .addIf(!drop && turnover, fumbler, MatchStat.FUMBLES_LOST, 1);

        return new Play.LooseBall(cause, fumbler.id(), recoverer.id(), recoverer.side(), turnover);
    }
}
