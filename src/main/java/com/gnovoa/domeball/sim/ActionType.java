package com.gnovoa.domeball.sim;

public enum ActionType {
    RUN,
    PASS,
    KICK,
    DEFENSE
}
