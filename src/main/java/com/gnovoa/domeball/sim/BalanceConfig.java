package com.gnovoa.domeball.sim;

import com.gnovoa.domeball.events.EventPriority;

/**
 * Game balance constants consumed by the engine.
 *
 * <p>Bound from {@code engine.balance.*} when running inside Spring; {@link #defaults()} gives the
 * same values to code that builds engines directly. Missing sections fall back to their defaults.
 */
public record BalanceConfig(
        Clock clock,
        Stamina stamina,
        ActionWeights actions,
        Run run,
        Pass pass,
        Tackle tackle,
        Kick kick) {

    public BalanceConfig {
        if (clock == null) clock = Clock.defaults();
        if (stamina == null) stamina = Stamina.defaults();
        if (actions == null) actions = ActionWeights.defaults();
        if (run == null) run = Run.defaults();
        if (pass == null) pass = Pass.defaults();
        if (tackle == null) tackle = Tackle.defaults();
        if (kick == null) kick = Kick.defaults();
    }

    public static BalanceConfig defaults() {
        return new BalanceConfig(null, null, null, null, null, null, null);
    }

    public BalanceConfig withActions(ActionWeights actions) {
        return new BalanceConfig(clock, stamina, actions, run, pass, tackle, kick);
    }

    /**
     * Game-clock seconds consumed per event: {@code baseSeconds} for downtime plus
     * {@code secondsPerTier} for every tier of importance above it.
     */
    public record Clock(int baseSeconds, int secondsPerTier) {
        public Clock {
            if (baseSeconds <= 0) throw new IllegalArgumentException("clock.baseSeconds must be positive");
            if (secondsPerTier < 0) throw new IllegalArgumentException("clock.secondsPerTier must not be negative");
        }

        public static Clock defaults() { return new Clock(5, 5); }

        public int secondsFor(EventPriority priority) {
            return baseSeconds + (EventPriority.DOWNTIME.level() - priority.level()) * secondsPerTier;
        }
    }

    public record Stamina(
            double baseDrain,
            double demandingRoleMultiplier,
            double fatigueThreshold,
            double maxFatiguePenalty) {
        public Stamina {
            if (fatigueThreshold <= 0) throw new IllegalArgumentException("stamina.fatigueThreshold must be positive");
            if (maxFatiguePenalty < 0 || maxFatiguePenalty > 1) {
                throw new IllegalArgumentException("stamina.maxFatiguePenalty must be within [0, 1]");
            }
        }

        public static Stamina defaults() { return new Stamina(1.0, 1.5, 20, 0.5); }
    }

    public record ActionWeights(
            double run,
            double pass,
            double kick,
            double defense,
            double clutchPassMultiplier,
            double clutchRunMultiplier) {
        public ActionWeights {
            if (run < 0 || pass < 0 || kick < 0 || defense < 0) {
                throw new IllegalArgumentException("action weights must not be negative");
            }
            if (run + pass + kick + defense <= 0) {
                throw new IllegalArgumentException("at least one action weight must be positive");
            }
        }

        public static ActionWeights defaults() { return new ActionWeights(0.40, 0.30, 0.10, 0.20, 1.2, 1.1); }

        public static ActionWeights runOnly() { return new ActionWeights(1, 0, 0, 0, 1, 1); }
    }

    /** Run resolution; success values are percentage points. */
    public record Run(
            double baseSuccess,
            int breakawayYards,
            double breakawaySpeed,
            double breakawayScoreChance,
            double scoreChance) {
        public static Run defaults() { return new Run(50, 12, 30, 0.40, 0.05); }
    }

    public record Pass(
            double baseAccuracy,
            double catchBase,
            int deepPassYards,
            double interceptionChance,
            double deepScoreChance,
            double scoreChance) {
        public static Pass defaults() { return new Pass(55, 85, 20, 0.25, 0.30, 0.06); }
    }

    /** Forced-fumble chance in percentage points, clamped to {@code [minFumbleChance, maxFumbleChance]}. */
    public record Tackle(
            double fumbleBase,
            double minFumbleChance,
            double maxFumbleChance,
            double highPowerThreshold) {
        public Tackle {
            if (minFumbleChance > maxFumbleChance) {
                throw new IllegalArgumentException("tackle.minFumbleChance exceeds tackle.maxFumbleChance");
            }
        }

        public static Tackle defaults() { return new Tackle(8, 2, 35, 30); }
    }

    public record Kick(double scoreDivisor) {
        public Kick {
            if (scoreDivisor <= 0) throw new IllegalArgumentException("kick.scoreDivisor must be positive");
        }

        public static Kick defaults() { return new Kick(200); }
    }
}
