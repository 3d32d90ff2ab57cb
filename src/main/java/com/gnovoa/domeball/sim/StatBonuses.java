package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.model.Stat;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Sparse, immutable set of additive adjustments to the fixed {@link Stat} schema.
 *
 * <p>External data keyed by free-form names enters through {@link #fromExternal}; that is the only
 * place where an unknown name is tolerated.
 */
public record StatBonuses(Map<Stat, Double> values) {

    private static final StatBonuses NONE = new StatBonuses(Map.of());

    public StatBonuses {
        EnumMap<Stat, Double> copy = new EnumMap<>(Stat.class);
        if (values != null) copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    public static StatBonuses none() {
        return NONE;
    }

    public static StatBonuses of(Stat stat, double amount) {
        return none().with(stat, amount);
    }

    /**
     * Converts name-keyed bonuses (tactics, items) into typed ones.
     *
     * @param raw bonuses keyed by stat name, may be null
     * @param onUnknown receives every name that does not match a stat
     */
    public static StatBonuses fromExternal(Map<String, Double> raw, Consumer<String> onUnknown) {
        if (raw == null || raw.isEmpty()) return NONE;
        EnumMap<Stat, Double> typed = new EnumMap<>(Stat.class);
        raw.forEach((name, amount) -> Stat.fromName(name).ifPresentOrElse(
                stat -> typed.merge(stat, amount, Double::sum),
                () -> onUnknown.accept(name)));
        return new StatBonuses(typed);
    }

    public double get(Stat stat) {
        return values.getOrDefault(stat, 0.0);
    }

    public StatBonuses with(Stat stat, double amount) {
        EnumMap<Stat, Double> copy = new EnumMap<>(Stat.class);
        copy.putAll(values);
        copy.merge(stat, amount, Double::sum);
        return new StatBonuses(copy);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
