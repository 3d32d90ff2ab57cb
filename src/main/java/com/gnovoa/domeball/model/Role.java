package com.gnovoa.domeball.model;

import java.util.Locale;

/** Field role of a player. Unrecognised roster tags become {@link #UNKNOWN}. */
public enum Role {
    PASSER,
    RUNNER,
    BLOCKER,
    UNKNOWN;

    /** @return true for roles that drain stamina faster. */
    public boolean isDemanding() {
        return this == PASSER || this == RUNNER;
    }

    public static Role fromTag(String tag) {
        if (tag == null || tag.isBlank()) return UNKNOWN;
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
