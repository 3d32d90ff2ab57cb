package com.gnovoa.domeball.model;

public enum TeamSide {
    HOME,
    AWAY;

    public TeamSide opposite() {
        return this == HOME ? AWAY : HOME;
    }
}
