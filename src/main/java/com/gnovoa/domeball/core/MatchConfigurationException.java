package com.gnovoa.domeball.core;

/**
 * Thrown at match construction when a roster or lineup cannot support a simulation. No tick
 * ever runs for a match that failed this way.
 */
public class MatchConfigurationException extends IllegalArgumentException {

    private final String teamId;

    public MatchConfigurationException(String teamId, String message) {
        super(teamId == null ? message : "Team " + teamId + ": " + message);
        this.teamId = teamId;
    }

    /** @return offending team, or null when the problem is not team specific */
    public String teamId() { return teamId; }
}
