package com.gnovoa.domeball.model;

import java.util.Locale;

/**
 * Closed set of player races.
 *
 * <p>Roster data carries the race as a free-form tag. Tags that do not name a known race map to
 * {@link #UNKNOWN}, which receives no modifiers of any kind.
 */
public enum Race {
    HUMAN,
    SYLVAN,
    GRYLL,
    LUMINA,
    UMBRA,
    UNKNOWN;

    /**
     * Resolves a roster tag (case-insensitive).
     *
     * @param tag race tag from roster data, may be null
     * @return matching race or {@link #UNKNOWN}
     */
    public static Race fromTag(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
