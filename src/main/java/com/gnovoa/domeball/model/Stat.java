package com.gnovoa.domeball.model;

import java.util.Locale;
import java.util.Optional;

/** The fixed attribute schema every player is rated on. */
public enum Stat {
    SPEED,
    POWER,
    THROWING,
    CATCHING,
    KICKING,
    STAMINA,
    AGILITY,
    LEADERSHIP;

    /**
     * Looks up a stat by external name, e.g. a tactics bonus key such as {@code "speed"}.
     *
     * @param name external stat name (case-insensitive)
     * @return the stat, or empty when the name is not part of the schema
     */
    public static Optional<Stat> fromName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
