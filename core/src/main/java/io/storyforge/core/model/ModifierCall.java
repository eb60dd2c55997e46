package io.storyforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A single modifier invocation attached to a node: {@code name} plus the literal parameters from
 * {@code name(p1,p2)}. A token without parentheses, or with empty ones, has no parameters.
 *
 * <p>Immutable and thread-safe.
 *
 * @param name the modifier name looked up in the registry
 * @param params literal parameters, in order
 * @param token the original token as written in the grammar
 */
public record ModifierCall(String name, List<String> params, String token) {

    public ModifierCall {
        Objects.requireNonNull(name, "name must not be null");
        params = params != null ? List.copyOf(params) : List.of();
        token = token != null ? token : name;
    }

    /** Creates a parameterless call. */
    public static ModifierCall of(String name) {
        return new ModifierCall(name, List.of(), name);
    }
}
