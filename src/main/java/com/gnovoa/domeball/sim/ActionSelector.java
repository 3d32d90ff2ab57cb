package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.MatchPhase;
import com.gnovoa.domeball.core.MatchState;

/** Picks the action for a tick by weighted draw. Consumes exactly one RNG value. */
public final class ActionSelector {

    private final BalanceConfig.ActionWeights weights;

    public ActionSelector(BalanceConfig.ActionWeights weights) {
        this.weights = weights;
    }

    public ActionType select(MatchState state) {
        double run = weights.run();
        double pass = weights.pass();
        double kick = weights.kick();
        double defense = weights.defense();

        if (state.phase() == MatchPhase.CLUTCH) {
            pass *= weights.clutchPassMultiplier();
            run *= weights.clutchRunMultiplier();
        }

        double total = run + pass + kick + defense;
        double r = state.rng().nextDouble() * total;

        if (r < run) return ActionType.RUN;
        r -= run;
        if (r < pass) return ActionType.PASS;
        r -= pass;
        if (r < kick) return ActionType.KICK;
        if (defense > 0) return ActionType.DEFENSE;
        // rounding at the top of the range
        if (kick > 0) return ActionType.KICK;
        return pass > 0 ? ActionType.PASS : ActionType.RUN;
    }
}
