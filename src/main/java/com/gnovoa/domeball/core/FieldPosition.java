package com.gnovoa.domeball.core;

/** Position on the field in yards; x grows towards the away team's goal. */
public record FieldPosition(double x, double y) {

    public static final FieldPosition ORIGIN = new FieldPosition(0, 0);

    public FieldPosition advance(double dx) {
        return new FieldPosition(x + dx, y);
    }
}
