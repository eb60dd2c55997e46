package io.storyforge.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.storyforge.core.spi.RandomSource;
import java.util.Objects;
import java.util.Optional;

/**
 * Uniform selection over an alternative list. All randomness comes from the injected {@link
 * RandomSource}, so a fixed source yields a fixed selection.
 */
public final class RandomSelector {

    private final RandomSource random;

    public RandomSelector(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Picks one element of {@code alternatives} with equal probability.
     *
     * @param alternatives a JSON array
     * @return the picked element, or empty for an empty array
     */
    public Optional<JsonNode> pick(JsonNode alternatives) {
        if (!alternatives.isArray()) {
            throw new IllegalArgumentException("alternatives must be an array, got: " + alternatives.getNodeType());
        }
        if (alternatives.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(alternatives.get(pickIndex(alternatives.size())));
    }

    /**
     * Picks an index in {@code [0, size)}. Out-of-range values from a misbehaving source wrap
     * around into range.
     */
    public int pickIndex(int size) {
        int index = random.nextInt(size);
        return Math.floorMod(index, size);
    }
}
