package com.gnovoa.domeball.commentary;

/** Template pools of the phrase bank. Every category must have at least one template. */
public enum PhraseCategory {
    // runs
    STANDARD_RUN,
    STUFFED_RUN,
    BREAKAWAY_RUN,
    SKILL_RUN,
    UMBRA_RUN,
    GRYLL_RUN,
    FATIGUE_RUN,
    SCORE,

    // passes
    STANDARD_COMPLETION,
    DEEP_PASS,
    LUMINA_PASS,
    INCOMPLETE_PASS,
    INTERCEPTION,
    DROPPED_PASS,

    // defense and loose balls
    STANDARD_TACKLE,
    HIGH_POWER_TACKLE,
    FUMBLE,
    SCRAMBLE_OFFENSE,
    SCRAMBLE_DEFENSE,

    // kicks
    KICK,
    KICK_SCORE
}
