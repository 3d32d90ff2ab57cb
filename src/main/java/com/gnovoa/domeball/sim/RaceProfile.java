package com.gnovoa.domeball.sim;

/**
 * Per-race data: additive stat deltas, a stamina drain multiplier and an optional passive
 * regeneration rule.
 */
public record RaceProfile(StatBonuses statDeltas, double drainMultiplier, Regeneration regeneration) {

    public static final RaceProfile NEUTRAL = new RaceProfile(StatBonuses.none(), 1.0, Regeneration.NONE);

    public RaceProfile {
        if (statDeltas == null) statDeltas = StatBonuses.none();
        if (regeneration == null) regeneration = Regeneration.NONE;
    }

    /** Chance-gated stamina gain applied once per tick to an on-field player. */
    public record Regeneration(double chance, double amount) {
        public static final Regeneration NONE = new Regeneration(0, 0);

        public boolean isActive() {
            return chance > 0 && amount > 0;
        }
    }
}
