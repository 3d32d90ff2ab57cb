package com.gnovoa.domeball.sim;

import java.util.List;

/**
 * Source of every stochastic decision made during a match.
 *
 * <p>Implementations must be pure functions of their internal state so that a match can be
 * replayed from its seed.
 */
public interface RandomSource {

    /** @return uniformly distributed value in {@code [0, 1)} */
    double nextDouble();


    /**
     * Picks one element uniformly, consuming exactly one draw.
     *
     * @throws IllegalArgumentException if {@code options} is empty
     */
    default <T> T choice(List<T> options) {
        if (options.isEmpty()) throw new IllegalArgumentException("Cannot choose from an empty list");
        return options.get((int) (nextDouble() * options.size()));
    }
}
