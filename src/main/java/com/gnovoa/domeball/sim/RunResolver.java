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
 * Ground play: a ball carrier against the defending unit.
 *
 * <ol>
 *   <li>Carrier: a random on-field RUNNER, or any on-field player when the lineup has none.</li>
 *   <li>{@code powerContest = carrier power - mean defense power};
 *       {@code speedContest = carrier speed - mean defense power / 2}. Neither is clamped.</li>
 *   <li>Success when {@code roll*100 < baseSuccess + powerContest + skill bonus}. Success gains
 *       {@code floor(2 + speedContest/5 + roll*5)} yards, failure {@code floor(roll*3)}; never
 *       below zero.</li>
 *   <li>Breakaway at {@code breakawayYards}+ with effective speed above {@code breakawaySpeed}.</li>
 *   <li>Score roll, likelier on a breakaway.</li>
 * </ol>
 *
 * <p>A run never causes a turnover on its own; fumbles come from {@link TackleResolver}.
 */
public final class RunResolver implements ActionResolver {

    private final BalanceConfig.Run config;
    private final EffectiveStatsCalculator calculator;

    public RunResolver(BalanceConfig.Run config, EffectiveStatsCalculator calculator) {
        this.config = config;
        this.calculator = calculator;
    }

    @Override
    public ActionType action() { return ActionType.RUN; }

    @Override
    public MatchEvent resolve(MatchState state) {
        RandomSource rng = state.rng();
        TeamState offense = state.possessingTeam();
        TeamState defense = state.defendingTeam();

        PlayerState carrier = Participants.preferring(Role.RUNNER, offense.onFieldPlayers(), rng);
        EffectiveStats carrierStats = calculator.calculate(carrier);
        double defensePower = Participants.average(defense.onFieldPlayers(), p -> calculator.calculate(p).power());

        double powerContest = carrierStats.power() - defensePower;
        double speedContest = carrierStats.speed() - defensePower / 2;

        int yards;
        if (rng.nextDouble() * 100 < config.baseSuccess() + powerContest + skillBonus(carrier)) {
            yards = (int) Math.floor(2 + speedContest / 5 + rng.nextDouble() * 5);
        } else {
            yards = (int) Math.floor(rng.nextDouble() * 3);
        }
        yards = Math.max(0, yards);

        boolean breakaway = yards >= config.breakawayYards() && carrierStats.speed() > config.breakawaySpeed();
        double scoreChance = breakaway ? config.breakawayScoreChance() : config.scoreChance();
        boolean score = rng.nextDouble() < scoreChance;

        EventPriority priority = breakaway ? EventPriority.IMPORTANT : EventPriority.STANDARD;
        MatchEventType type = MatchEventType.ROUTINE_PLAY;
        if (score) {
            type = MatchEventType.SCORE;
            priority = EventPriority.CRITICAL;
        }

        StatDeltas deltas = new StatDeltas()
                .add(carrier, MatchStat.PLAYS, 1)
                .add(carrier, MatchStat.RUSHING_ATTEMPTS, 1)
                .add(carrier, MatchStat.RUSHING_YARDS, yards)
                .addIf(breakaway, carrier, MatchStat.BREAKAWAY_RUNS, 1)
                .addIf(score, carrier, MatchStat.SCORES, 1);

        return state.draftEvent(
                type,
                priority,
                List.of(carrier.id()),
                new Play.Run(carrier.id(), yards, breakaway, score),
                new EventStats(deltas.build(), false, false));
    }

    private static double skillBonus(PlayerState carrier) {
        double bonus = 0;
        for (Skill skill : carrier.skills()) bonus += skill.runSuccessBonus();
        return bonus;
    }
}
