package com.gnovoa.domeball.sim;

/**
 * Maps current stamina to a fatigue penalty: zero at or above the threshold, then linear up to
 * the maximum penalty at zero stamina.
 */
public record FatigueCurve(double threshold, double maxPenalty) {

    public static FatigueCurve from(BalanceConfig.Stamina stamina) {
        return new FatigueCurve(stamina.fatigueThreshold(), stamina.maxFatiguePenalty());
    }

    public double penaltyFor(double currentStamina) {
        if (currentStamina >= threshold) return 0;
        double stamina = Math.max(0, currentStamina);
        return (threshold - stamina) / threshold * maxPenalty;
    }
}
