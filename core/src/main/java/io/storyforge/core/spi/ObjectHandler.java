package io.storyforge.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Pluggable generator for rule content expressed as an object, e.g. {@code {"handler":
 * "discrete-distribution", "weights": [...], "values": [...]}}. Registered by name with {@code
 * Grammar.addObjectHandler()}; the {@code "handler"} field of the rule content selects it.
 *
 * <p>Implementations should be stateless; all randomness must come from the supplied {@link
 * RandomSource}.
 */
@FunctionalInterface
public interface ObjectHandler {

    /**
     * Samples a value from the given rule content.
     *
     * @param content the rule content object, including its {@code "handler"} field
     * @param random the grammar's randomness source
     * @return the sampled value; the engine requires a textual node
     * @throws io.storyforge.core.error.UnexpectedTypeException if {@code content} is not an object
     * @throws io.storyforge.core.error.HandlerValidationException if required parameters are
     *     missing or malformed
     */
    JsonNode apply(JsonNode content, RandomSource random);
}
