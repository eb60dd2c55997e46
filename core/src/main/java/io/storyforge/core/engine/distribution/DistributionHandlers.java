package io.storyforge.core.engine.distribution;

import com.fasterxml.jackson.databind.JsonNode;
import io.storyforge.core.error.HandlerValidationException;
import io.storyforge.core.error.UnexpectedTypeException;
import io.storyforge.core.spi.ObjectHandler;
import io.storyforge.core.spi.RandomSource;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in object handlers for weighted selection.
 *
 * <pre>{@code
 * {"handler": "binomial-distribution", "success-rate": 0.3, "values": ["none", "one", "two"]}
 * {"handler": "discrete-distribution", "weights": [1, 3], "values": ["rare", "common"]}
 * }</pre>
 *
 * <p>The binomial handler runs {@code values.size() - 1} Bernoulli trials with the given success
 * rate (default 0.5) and picks the value indexed by the number of successes. The discrete handler
 * picks each value with probability proportional to its weight.
 */
public final class DistributionHandlers {

    public static final String BINOMIAL = "binomial-distribution";
    public static final String DISCRETE = "discrete-distribution";

    private static final double DEFAULT_SUCCESS_RATE = 0.5;

    private DistributionHandlers() {}

    /** Fresh map of the built-in handlers. */
    public static Map<String, ObjectHandler> create() {
        Map<String, ObjectHandler> handlers = new LinkedHashMap<>();
        handlers.put(BINOMIAL, DistributionHandlers::binomial);
        handlers.put(DISCRETE, DistributionHandlers::discrete);
        return handlers;
    }

    static JsonNode binomial(JsonNode content, RandomSource random) {
        requireObject(content, BINOMIAL);
        JsonNode values = requireValues(content, BINOMIAL);

        double successRate = DEFAULT_SUCCESS_RATE;
        JsonNode rateNode = content.get("success-rate");
        if (rateNode != null) {
            if (!rateNode.isNumber()) {
                throw new HandlerValidationException("'success-rate' must be a number", BINOMIAL);
            }
            successRate = rateNode.asDouble();
            if (successRate < 0.0 || successRate > 1.0) {
                throw new HandlerValidationException(
                        "'success-rate' must be between 0 and 1, got: " + successRate, BINOMIAL);
            }
        }

        int successes = 0;
        for (int trial = 0; trial < values.size() - 1; trial++) {
            if (random.nextDouble() < successRate) {
                successes++;
            }
        }
        return values.get(successes);
    }

    static JsonNode discrete(JsonNode content, RandomSource random) {
        requireObject(content, DISCRETE);
        JsonNode values = requireValues(content, DISCRETE);

        JsonNode weights = content.get("weights");
        if (weights == null || !weights.isArray()) {
            throw new HandlerValidationException("'weights' must be an array", DISCRETE);
        }
        if (weights.size() != values.size()) {
            throw new HandlerValidationException(
                    "'weights' has " + weights.size() + " entries but 'values' has " + values.size(), DISCRETE);
        }
        double total = 0.0;
        for (JsonNode weight : weights) {
            if (!weight.isNumber() || weight.asDouble() < 0.0) {
                throw new HandlerValidationException("'weights' must be non-negative numbers, got: " + weight, DISCRETE);
            }
            total += weight.asDouble();
        }
        if (total <= 0.0) {
            throw new HandlerValidationException("'weights' must not all be zero", DISCRETE);
        }

        double target = random.nextDouble() * total;
        double cumulative = 0.0;
        for (int i = 0; i < values.size(); i++) {
            cumulative += weights.get(i).asDouble();
            if (target < cumulative) {
                return values.get(i);
            }
        }
        // Rounding can leave target at the very top of the range; the last positive weight owns it.
        for (int i = values.size() - 1; i >= 0; i--) {
            if (weights.get(i).asDouble() > 0.0) {
                return values.get(i);
            }
        }
        return values.get(values.size() - 1);
    }

    private static void requireObject(JsonNode content, String handler) {
        if (content == null || !content.isObject()) {
            throw new UnexpectedTypeException(
                    "Handler '" + handler + "' expects an object, got: "
                            + (content == null ? "null" : content.getNodeType().toString()),
                    null,
                    null);
        }
    }

    private static JsonNode requireValues(JsonNode content, String handler) {
        JsonNode values = content.get("values");
        if (values == null || !values.isArray() || values.isEmpty()) {
            throw new HandlerValidationException("'values' must be a non-empty array", handler);
        }
        return values;
    }
}
