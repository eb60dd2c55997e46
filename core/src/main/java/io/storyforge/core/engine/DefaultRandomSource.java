package io.storyforge.core.engine;

import io.storyforge.core.spi.RandomSource;
import java.util.Random;

/** {@link RandomSource} backed by {@link java.util.Random}. Seedable for reproducible output. */
public final class DefaultRandomSource implements RandomSource {

    private final Random random;

    /** Unseeded source. */
    public DefaultRandomSource() {
        this(new Random());
    }

    /** Source with a fixed seed. */
    public DefaultRandomSource(long seed) {
        this(new Random(seed));
    }

    public DefaultRandomSource(Random random) {
        this.random = random;
    }

    @Override
    public int nextInt(int bound) {
        return random.nextInt(bound);
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
