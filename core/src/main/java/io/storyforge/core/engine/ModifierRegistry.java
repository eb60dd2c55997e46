package io.storyforge.core.engine;

import io.storyforge.core.error.ModifierFailedException;
import io.storyforge.core.error.ParameterCountException;
import io.storyforge.core.model.ModifierCall;
import io.storyforge.core.model.ParseNode;
import io.storyforge.core.model.ParseTree;
import io.storyforge.core.spi.ExpansionListener.UnknownModifierEvent;
import io.storyforge.core.spi.Modifier;
import io.storyforge.core.spi.NodeModifier;
import io.storyforge.core.spi.TextModifier;
import io.storyforge.core.spi.TreeModifier;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named modifiers, and the dispatch that applies a node's modifiers to its flattened
 * text. Registration and lookup can happen concurrently, but registering while trees are being
 * flattened makes the output depend on timing.
 */
public final class ModifierRegistry {

    private final Map<String, Modifier> modifiers = new ConcurrentHashMap<>();

    /**
     * Registers a modifier. If a modifier with the same name is already registered, it is replaced
     * (last-write-wins semantics).
     *
     * @param name the name used after a {@code .} in rule references
     * @param modifier the modifier
     * @throws NullPointerException if name or modifier is null
     * @throws IllegalArgumentException if name is empty
     */
    public void register(String name, Modifier modifier) {
        if (name == null) {
            throw new NullPointerException("modifier name must not be null");
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("modifier name must not be empty");
        }
        if (modifier == null) {
            throw new NullPointerException("modifier must not be null");
        }
        modifiers.put(name, modifier);
    }

    /** Registers every entry of {@code entries}. */
    public void registerAll(Map<String, ? extends Modifier> entries) {
        entries.forEach(this::register);
    }

    /**
     * Looks up a modifier by name.
     *
     * @param name the modifier name (e.g. "capitalize")
     * @return the modifier, or empty if not registered
     */
    public Optional<Modifier> get(String name) {
        return Optional.ofNullable(modifiers.get(name));
    }

    /** Returns {@code true} if a modifier with the given name is registered. */
    public boolean has(String name) {
        return modifiers.containsKey(name);
    }

    /** Returns the number of registered modifiers. */
    public int size() {
        return modifiers.size();
    }

    /** Registered names. */
    public Set<String> names() {
        return Collections.unmodifiableSet(modifiers.keySet());
    }

    /**
     * Applies {@code node}'s modifiers left to right to {@code input}. Unknown names are reported
     * to the grammar's listener and skipped. Tree and node modifiers run at most once per node.
     *
     * @param tree the owning tree
     * @param node the node carrying the modifiers
     * @param input the node's text flattened without its own modifiers
     * @return the accumulated result after the last modifier
     * @throws ParameterCountException if a modifier is given the wrong number of parameters
     * @throws ModifierFailedException if a modifier rejects its input or parameters
     */
    public String apply(ParseTree tree, ParseNode node, String input) {
        String output = input;
        List<ModifierCall> calls = node.modifiers();
        for (int i = 0; i < calls.size(); i++) {
            ModifierCall call = calls.get(i);
            Modifier modifier = modifiers.get(call.name());
            if (modifier == null) {
                tree.grammar()
                        .notifyUnknownModifier(new UnknownModifierEvent(call.name(), node.ruleName(), node.text()));
                continue;
            }
            List<String> params = call.params();
            if (params.size() != modifier.arity()) {
                throw new ParameterCountException(
                        call.name(), modifier.arity(), params.size(), node.ruleName(), node.text());
            }
            try {
                output = invoke(tree, node, i, modifier, output, params);
            } catch (IllegalArgumentException e) {
                throw new ModifierFailedException(call.name(), e, node.ruleName(), node.text());
            }
        }
        return output;
    }

    private static String invoke(
            ParseTree tree, ParseNode node, int index, Modifier modifier, String input, List<String> params) {
        if (modifier instanceof TextModifier text) {
            return text.function().apply(input, params);
        } else if (modifier instanceof TreeModifier treeModifier) {
            return node.recordSideEffect(
                    index, () -> treeModifier.function().apply(tree, node.ruleName(), params));
        } else if (modifier instanceof NodeModifier nodeModifier) {
            return node.recordSideEffect(
                    index, () -> nodeModifier.function().apply(node, node.ruleName(), params));
        }
        throw new IllegalStateException("Unsupported modifier type: " + modifier.getClass().getName());
    }
}
