package com.gnovoa.domeball.core;

public enum MatchPhase {
    EARLY,
    MIDDLE,
    LATE,
    CLUTCH;

    /**
     * @param gameTime elapsed game-clock seconds
     * @param maxTime match duration in seconds
     */
    public static MatchPhase at(int gameTime, int maxTime) {
        double progress = (double) gameTime / maxTime;
        if (progress < 0.25) return EARLY;
        if (progress < 0.75) return MIDDLE;
        if (progress < 0.90) return LATE;
        return CLUTCH;
    }
}
