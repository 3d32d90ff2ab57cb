package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.model.Stat;
import java.util.Map;

/** A player's attributes after bonuses, race modifiers and fatigue. */
public record EffectiveStats(
        double speed,
        double power,
        double throwing,
        double catching,
        double kicking,
        double stamina,
        double agility,
        double leadership) {

    static EffectiveStats of(Map<Stat, Double> values) {
        return new EffectiveStats(
                values.get(Stat.SPEED),
                values.get(Stat.POWER),
                values.get(Stat.THROWING),
                values.get(Stat.CATCHING),
                values.get(Stat.KICKING),
                values.get(Stat.STAMINA),
                values.get(Stat.AGILITY),
                values.get(Stat.LEADERSHIP));
    }

    public double get(Stat stat) {
        return switch (stat) {
            case SPEED -> speed;
            case POWER -> power;
            case THROWING -> throwing;
            case CATCHING -> catching;
            case KICKING -> kicking;
            case STAMINA -> stamina;
            case AGILITY -> agility;
            case LEADERSHIP -> leadership;
        };
    }
}
