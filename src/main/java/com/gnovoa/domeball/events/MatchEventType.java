package com.gnovoa.domeball.events;

public enum MatchEventType {
    /** Ball stays with the offense, or changes hands by a kick. */
    ROUTINE_PLAY,
    SCORE,
    /** Defense gained possession by interception or loose-ball recovery. */
    TURNOVER
}
