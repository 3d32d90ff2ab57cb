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
 * Passing play. The throw is checked for accuracy against the defense's mean agility, then the
 * catch against the receiver's hands. A dropped ball goes to a scramble, a wild throw may be
 * intercepted.
 */
public final class PassResolver implements ActionResolver {

    private final BalanceConfig.Pass config;
    private final EffectiveStatsCalculator calculator;
    private final LooseBallResolver looseBall;

    public PassResolver(BalanceConfig.Pass config, EffectiveStatsCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
        this.looseBall = new LooseBallResolver(calculator);
    }

    @Override
    public ActionType action() { return ActionType.PASS; }

    @Override
    public MatchEvent resolve(MatchState state) {
        RandomSource rng = state.rng();
        TeamState offense = state.possessingTeam();
        TeamState defense = state.defendingTeam();

        PlayerState passer = Participants.preferring(Role.PASSER, offense.onFieldPlayers(), rng);
        List<PlayerState> targets = offense.onFieldPlayers().stream().filter(p -> p != passer).toList();
        PlayerState receiver = Participants.preferring(Role.RUNNER, targets, rng);

        EffectiveStats passerStats = calculator.calculate(passer);
        EffectiveStats receiverStats = calculator.calculate(receiver);
        double defenseAgility = Participants.average(defense.onFieldPlayers(), p -> calculator.calculate(p).agility());

        StatDeltas deltas = new StatDeltas()
                .add(passer, MatchStat.PLAYS, 1)
                .add(passer, MatchStat.PASS_ATTEMPTS, 1);

        double accuracy = config.baseAccuracy() + (passerStats.throwing() - defenseAgility) + skillBonus(passer);
        if (rng.nextDouble() * 100 < accuracy) {
            double catchChance = config.catchBase() + (receiverStats.catching() - 20);
            if (rng.nextDouble() * 100 < catchChance) {
                return completion(state, passer, receiver, passerStats, deltas);
            }
            Play.LooseBall loose = looseBall.scramble(state, receiver, Play.LooseBallCause.DROP, deltas);
            return state.draftEvent(
                    loose.turnover() ? MatchEventType.TURNOVER : MatchEventType.ROUTINE_PLAY,
                    EventPriority.IMPORTANT,
                    List.of(passer.id(), receiver.id(), loose.recoveredById()),
                    new Play.Pass(passer.id(), receiver.id(), Play.PassOutcome.DROPPED, 0, false, false, null, loose),
                    new EventStats(deltas.build(), loose.turnover(), false));
        }

        if (rng.nextDouble() < config.interceptionChance()) {
            PlayerState interceptor = rng.choice(defense.onFieldPlayers());
            deltas.add(passer, MatchStat.INTERCEPTIONS_THROWN, 1)
                    .add(interceptor, MatchStat.INTERCEPTIONS, 1);
            return state.draftEvent(
                    MatchEventType.TURNOVER,
                    EventPriority.IMPORTANT,
                    List.of(passer.id(), receiver.id(), interceptor.id()),
                    new Play.Pass(passer.id(), receiver.id(), Play.PassOutcome.INTERCEPTED, 0, false, false, interceptor.id(), null),
                    new EventStats(deltas.build(), true, false));
        }

        return state.draftEvent(
                MatchEventType.ROUTINE_PLAY,
                EventPriority.STANDARD,
                List.of(passer.id(), receiver.id()),
                new Play.Pass(passer.id(), receiver.id(), Play.PassOutcome.INCOMPLETE, 0, false, false, null, null),
                new EventStats(deltas.build(), false, false));
    }

    private MatchEvent completion(MatchState state, PlayerState passer, PlayerState receiver,
                                  EffectiveStats passerStats, StatDeltas deltas) {
        RandomSource rng = state.rng();
        int yards = Math.max(0, (int) Math.floor(4 + passerStats.throwing() / 5 + rng.nextDouble() * 10));
        boolean deep = yards >= config.deepPassYards();
        boolean score = rng.nextDouble() < (deep ? config.deepScoreChance() : config.scoreChance());

        deltas.add(passer, MatchStat.PASS_COMPLETIONS, 1)
                .add(passer, MatchStat.PASSING_YARDS, yards)
                .add(receiver, MatchStat.CATCHES, 1)
                .add(receiver, MatchStat.RECEIVING_YARDS, yards)
                .addIf(score, receiver, MatchStat.SCORES, 1);

        EventPriority priority = score ? EventPriority.CRITICAL : deep ? EventPriority.IMPORTANT : EventPriority.STANDARD;
        return state.draftEvent(
                score ? MatchEventType.SCORE : MatchEventType.ROUTINE_PLAY,
                priority,
                List.of(passer.id(), receiver.id()),
                new Play.Pass(passer.id(), receiver.id(), Play.PassOutcome.COMPLETE, yards, deep, score, null, null),
                new EventStats(deltas.build(), false, false));
    }

    private static double skillBonus(PlayerState passer) {
        double bonus = 0;
        for (Skill skill : passer.skills()) bonus += skill.passAccuracyBonus();
        return bonus;
    }
}
