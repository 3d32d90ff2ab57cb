package com.gnovoa.domeball.sim;

import java.util.Objects;
import java.util.Random;

/**
 * {@link java.util.Random} seeded with the {@link String#hashCode()} of an identifier, normally
 * the match id.
 *
 * <p>Both algorithms are fixed by their Javadoc, so two instances built from the same seed and
 * called in the same order return bit-identical sequences on any JVM. Each match owns its own
 * instance.
 */
public final class DeterministicRandomSource implements RandomSource {

    private final Random random;
    private long draws;

    public DeterministicRandomSource(String seed) {
        this.random = new Random(Objects.requireNonNull(seed, "seed").hashCode());
    }

    /** @return number of values drawn so far */
    public long draws() { return draws; }

    @Override
    public double nextDouble() {
        draws++;
        return random.nextDouble();
    }
}
