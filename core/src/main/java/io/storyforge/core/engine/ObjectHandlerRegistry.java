package io.storyforge.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.storyforge.core.error.BadHandlerException;
import io.storyforge.core.spi.ObjectHandler;
import io.storyforge.core.spi.RandomSource;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of object handlers, keyed by the {@code "handler"} field of rule content. Thread-safe -
 * registration and lookup can happen concurrently.
 */
public final class ObjectHandlerRegistry {

    private static final String HANDLER_FIELD = "handler";

    private final Map<String, ObjectHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler. If a handler with the same name is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param name the handler name, e.g. "discrete-distribution"
     * @param handler the handler
     * @throws NullPointerException if name or handler is null
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, ObjectHandler handler) {
        if (name == null) {
            throw new NullPointerException("handler name must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("handler name must not be empty");
        }
        if (handler == null) {
            throw new NullPointerException("handler must not be null");
        }
        handlers.put(name, handler);
    }

    /** Registers every entry of {@code entries}. */
    public void registerAll(Map<String, ? extends ObjectHandler> entries) {
        entries.forEach(this::register);
    }

    /**
     * Looks up a handler by name.
     *
     * @return the handler, or empty if not registered
     */
    public Optional<ObjectHandler> get(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    /** Returns {@code true} if a handler with the given name is registered. */
    public boolean has(String name) {
        return handlers.containsKey(name);
    }

    /** Returns the number of registered handlers. */
    public int size() {
        return handlers.size();
    }

    /** Registered names. */
    public Set<String> names() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Samples text from object rule content: selects the handler named by its {@code "handler"}
     * field and requires a textual result.
     *
     * @param content the rule content object
     * @param random the grammar's randomness source
     * @param ruleName the rule being resolved, for error context
     * @param fragment the fragment being expanded, for error context
     * @return the sampled text
     * @throws BadHandlerException if the field is missing, the handler is unregistered, or the
     *     result is not a string
     */
    public String sample(JsonNode content, RandomSource random, String ruleName, String fragment) {
        JsonNode nameNode = content.get(HANDLER_FIELD);
        if (nameNode == null || !nameNode.isTextual()) {
            throw new BadHandlerException(
                    "Rule '" + ruleName + "' is an object without a string '" + HANDLER_FIELD + "' field",
                    null,
                    ruleName,
                    fragment);
        }
        String name = nameNode.asText();
        ObjectHandler handler = handlers.get(name);
        if (handler == null) {
            throw new BadHandlerException(
                    "No object handler registered for name: '" + name + "' (rule '" + ruleName + "')",
                    name,
                    ruleName,
                    fragment);
        }
        JsonNode result = handler.apply(content, random);
        if (result == null || !result.isTextual()) {
            throw new BadHandlerException(
                    "Object handler '" + name + "' returned "
                            + (result == null ? "null" : result.getNodeType().toString())
                            + " instead of a string (rule '" + ruleName + "')",
                    name,
                    ruleName,
                    fragment);
        }
        return result.asText();
    }
}
