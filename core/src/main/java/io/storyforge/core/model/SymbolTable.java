package io.storyforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runtime symbol table of a single expansion: each key maps to a stack of bound values. The
 * current value of a key is the top of its stack; binding pushes, {@link #pop(String)} unwinds.
 * When a key's stack becomes empty the key is removed entirely, so lookups fall through to the
 * static grammar rule of the same name.
 *
 * <p>Not thread-safe: owned by exactly one {@link ParseTree}.
 */
public final class SymbolTable {

    private final Map<String, Deque<JsonNode>> bindings = new LinkedHashMap<>();

    /** Creates an empty table. */
    public SymbolTable() {}

    /**
     * Binds {@code key} to {@code value}, shadowing any earlier binding.
     *
     * @param key the key name, non-null
     * @param value the structured value, non-null
     */
    public void push(String key, JsonNode value) {
        if (key == null) {
            throw new NullPointerException("key must not be null");
        }
        if (value == null) {
            throw new NullPointerException("value must not be null");
        }
        bindings.computeIfAbsent(key, k -> new ArrayDeque<>()).push(value);
    }

    /**
     * Removes the current binding of {@code key}, restoring the one it shadowed.
     *
     * @return the removed value, or empty if the key was not bound
     */
    public Optional<JsonNode> pop(String key) {
        Deque<JsonNode> stack = bindings.get(key);
        if (stack == null) {
            return Optional.empty();
        }
        JsonNode removed = stack.pop();
        if (stack.isEmpty()) {
            bindings.remove(key);
        }
        return Optional.of(removed);
    }

    /** The current value of {@code key}, or empty if unbound. */
    public Optional<JsonNode> lookup(String key) {
        Deque<JsonNode> stack = bindings.get(key);
        return stack == null ? Optional.empty() : Optional.of(stack.peek());
    }

    /** Returns {@code true} if {@code key} has at least one binding. */
    public boolean contains(String key) {
        return bindings.containsKey(key);
    }

    /** Number of stacked bindings for {@code key}; 0 if unbound. */
    public int depth(String key) {
        Deque<JsonNode> stack = bindings.get(key);
        return stack == null ? 0 : stack.size();
    }

    /** Currently bound keys, in first-binding order. */
    public Set<String> keys() {
        return Collections.unmodifiableSet(bindings.keySet());
    }

    /** Returns {@code true} if no key is bound. */
    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /** Independent copy; stacks are copied, values are shared (they are never mutated). */
    public SymbolTable copy() {
        SymbolTable copy = new SymbolTable();
        bindings.forEach((key, stack) -> copy.bindings.put(key, new ArrayDeque<>(stack)));
        return copy;
    }

    @Override
    public String toString() {
        return "SymbolTable" + bindings.keySet();
    }
}
