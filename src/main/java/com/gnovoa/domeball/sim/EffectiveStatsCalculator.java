package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.core.PlayerState;
import com.gnovoa.domeball.model.Stat;
import java.util.EnumMap;

/**
 * Computes {@link EffectiveStats} for a player. Side-effect free; safe to call any number of
 * times per tick.
 *
 * <p>Order of application: base stats, active bonuses, race deltas, then fatigue. Fatigue scales
 * speed and agility by {@code 1 - penalty} and power by the gentler
 * {@code (1 - penalty) * 0.5 + 0.5}.
 */
public final class EffectiveStatsCalculator {

    private final RaceProfiles races;

    public EffectiveStatsCalculator(RaceProfiles races) {
        this.races = races;
    }

    public EffectiveStats calculate(PlayerState player) {
        EnumMap<Stat, Double> stats = new EnumMap<>(Stat.class);
        for (Stat stat : Stat.values()) {
            stats.put(stat, (double) player.baseStat(stat));
        }

        player.activeBonuses().values().forEach((stat, bonus) -> stats.merge(stat, bonus, Double::sum));
        races.profile(player.race()).statDeltas().values().forEach((stat, delta) -> stats.merge(stat, delta, Double::sum));

        double fatigueMultiplier = 1 - player.fatiguePenalty();
        stats.put(Stat.SPEED, stats.get(Stat.SPEED) * fatigueMultiplier);
        stats.put(Stat.AGILITY, stats.get(Stat.AGILITY) * fatigueMultiplier);
        stats.put(Stat.POWER, stats.get(Stat.POWER) * (fatigueMultiplier * 0.5 + 0.5));

        return EffectiveStats.of(stats);
    }

    public RaceProfiles races() { return races; }
}
