package io.storyforge.core.spi;

/**
 * Source of randomness for alternative selection and object handlers. Injected into a {@code
 * Grammar} so that expansion is deterministic under a test double.
 */
public interface RandomSource {

    /**
     * Returns a value in {@code [0, bound)}.
     *
     * @param bound exclusive upper bound, must be positive
     * @return the selected index
     */
    int nextInt(int bound);

    /** Returns a value in {@code [0.0, 1.0)}. */
    double nextDouble();
}
