package com.gnovoa.domeball.events;

/**
 * Importance tier of an event. Drives commentary verbosity and how much game clock the event
 * consumes; level 1 is the most important.
 */
public enum EventPriority {
    CRITICAL(1),
    IMPORTANT(2),
    STANDARD(3),
    DOWNTIME(4);

    private final int level;

    EventPriority(int level) {
        this.level = level;
    }

    public int level() { return level; }
}
