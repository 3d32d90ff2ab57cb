package com.gnovoa.domeball.sim;

import java.util.Arrays;
import java.util.Optional;

/** Skills the resolvers understand. Any other skill string on a roster has no effect. */
public enum Skill {
    JUKE_MOVE("Juke Move", 10, 0),
    TRUCK_STICK("Truck Stick", 7, 0),
    DEADEYE("Deadeye", 0, 15),
    POCKET_PRESENCE("Pocket Presence", 0, 10);

    private final String displayName;
    private final double runSuccessBonus;
    private final double passAccuracyBonus;

    Skill(String displayName, double runSuccessBonus, double passAccuracyBonus) {
        this.displayName = displayName;
        this.runSuccessBonus = runSuccessBonus;
        this.passAccuracyBonus = passAccuracyBonus;
    }

    public String displayName() { return displayName; }

    /** @return percentage points added to run success */
    public double runSuccessBonus() { return runSuccessBonus; }

    /** @return percentage points added to pass accuracy */
    public double passAccuracyBonus() { return passAccuracyBonus; }

    public static Optional<Skill> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.displayName.equalsIgnoreCase(name.trim()) || s.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
