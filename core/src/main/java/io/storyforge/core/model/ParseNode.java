package io.storyforge.core.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.storyforge.core.engine.RuleResolver;
import io.storyforge.core.error.GrammarException;
import io.storyforge.core.spec.Fragment;
import io.storyforge.core.spec.PatternRecognizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A node of a {@link ParseTree}: the fragment of grammar text it was created from, and the
 * children produced the first time it is expanded.
 *
 * <p>{@code complete} is decided once at construction and never changes: a node is complete when
 * its text contains neither a rule reference nor an action group. Complete nodes are never
 * expanded; a node with children is never expanded again.
 *
 * <p>Hidden-ness is inherited by children at creation, so every node under an action renders as
 * the empty string in visible output.
 *
 * <p>Not thread-safe: owned by its parent (the tree owns the root).
 */
public final class ParseNode {

    private final String text;
    private final boolean complete;
    private final List<ParseNode> children = new ArrayList<>();
    private final List<ModifierCall> modifiers = new ArrayList<>();
    private final Map<Integer, String> sideEffectResults = new HashMap<>();
    private boolean expanded;
    private boolean hidden;
    private String key;
    private String ruleName;

    /**
     * Creates a detached node for {@code text}.
     *
     * @param text the raw grammar fragment
     */
    public ParseNode(String text) {
        this.text = text != null ? text : "";
        this.complete = PatternRecognizer.isComplete(this.text);
        this.expanded = complete;
    }

    /**
     * Performs one expansion step on this node: classifies its text and creates its children. A
     * no-op if the node is complete or was already expanded.
     *
     * @param resolver resolves rule names against the symbol table and the grammar
     * @param symbols the tree's symbol table; key-with-text actions bind into it directly
     */
    public void expand(RuleResolver resolver, SymbolTable symbols) {
        if (expanded) {
            return;
        }
        Fragment fragment = PatternRecognizer.recognize(text);
        switch (fragment.production()) {
            case ONLY_RULE -> {
                String output = resolver.resolve(fragment.ruleName(), symbols, text);
                ruleName = fragment.ruleName();
                fragment.modifiers().forEach(token -> modifiers.add(PatternRecognizer.parseModifier(token)));
                addChild(output);
            }
            case ONLY_RULE_WITH_ACTIONS, ONLY_ACTIONS, MIXED_TEXT -> fragment.parts().forEach(this::addChild);
            case KEYLESS_RULE_ACTION -> {
                hidden = true;
                addChild(fragment.parts().get(0)).key = "";
            }
            case KEY_WITH_RULE_ACTION -> {
                hidden = true;
                addChild(fragment.parts().get(0)).key = fragment.key();
            }
            case KEY_WITH_TEXT_ACTION -> {
                hidden = true;
                ArrayNode values = JsonNodeFactory.instance.arrayNode();
                if (fragment.parts().isEmpty()) {
                    addChild("");
                }
                for (String token : fragment.parts()) {
                    values.add(token);
                    addChild(token);
                }
                symbols.push(fragment.key(), values);
            }
            case LITERAL -> {
                // Complete text; unreachable because complete nodes start out expanded.
            }
        }
        expanded = true;
    }

    /**
     * Serializes this subtree.
     *
     * @param tree the owning tree, supplying the modifier registry and symbol table to modifiers
     * @param ignoreHidden render hidden leaves as the empty string
     * @param ignoreModifiers skip this node's own modifiers (children still apply theirs)
     * @return the flattened text
     */
    public String flatten(ParseTree tree, boolean ignoreHidden, boolean ignoreModifiers) {
        try {
            if (!modifiers.isEmpty() && !ignoreModifiers) {
                String base = flatten(tree, ignoreHidden, true);
                if (base.isEmpty()) {
                    return base;
                }
                return tree.grammar().modifiers().apply(tree, this, base);
            }
            if (children.isEmpty()) {
                return hidden && ignoreHidden ? "" : text;
            }
            StringBuilder sb = new StringBuilder();
            for (ParseNode child : children) {
                sb.append(child.flatten(tree, ignoreHidden, false));
            }
            return sb.toString();
        } catch (GrammarException e) {
            throw e.addFrame(text);
        }
    }

    private ParseNode addChild(String childText) {
        ParseNode child = new ParseNode(childText);
        child.hidden = hidden;
        children.add(child);
        return child;
    }

    /**
     * Invokes a side-effecting modifier at most once for this node, recording its result for later
     * flattens of the same node.
     *
     * @param index position of the modifier in {@link #modifiers()}
     * @param invocation the modifier call
     * @return the recorded or freshly computed result
     */
    public String recordSideEffect(int index, Supplier<String> invocation) {
        String recorded = sideEffectResults.get(index);
        if (recorded == null) {
            recorded = invocation.get();
            sideEffectResults.put(index, recorded != null ? recorded : "");
        }
        return sideEffectResults.get(index);
    }

    /** The last child, scanning right to left, that is not complete; {@code null} if none. */
    public ParseNode lastExpandableChild() {
        for (int i = children.size() - 1; i >= 0; i--) {
            if (!children.get(i).complete) {
                return children.get(i);
            }
        }
        return null;
    }

    /** Children that still need expansion, in document order. */
    public List<ParseNode> incompleteChildren() {
        List<ParseNode> pending = new ArrayList<>();
        for (ParseNode child : children) {
            if (!child.complete) {
                pending.add(child);
            }
        }
        return pending;
    }

    /** Returns {@code true} if every child is complete (vacuously true without children). */
    public boolean areChildrenComplete() {
        return children.stream().allMatch(ParseNode::isComplete);
    }

    /** Whether this node and every descendant have been expanded as far as they go. */
    public boolean isResolved() {
        if (complete) {
            return true;
        }
        return expanded && children.stream().allMatch(ParseNode::isResolved);
    }

    /** The raw fragment this node was created from. */
    public String text() {
        return text;
    }

    public boolean isComplete() {
        return complete;
    }

    /** Whether {@link #expand} has run (always true for complete nodes). */
    public boolean isExpanded() {
        return expanded;
    }

    public boolean isHidden() {
        return hidden;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public List<ParseNode> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * The symbol-table key this node's value is bound to when it completes. Empty means no binding;
     * an empty string means the node is resolved for its side effects and the value discarded.
     */
    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    /** The rule this node was expanded from, or {@code null} for non-rule nodes. */
    public String ruleName() {
        return ruleName;
    }

    public List<ModifierCall> modifiers() {
        return Collections.unmodifiableList(modifiers);
    }

    @Override
    public String toString() {
        return "ParseNode{text='" + text + "', complete=" + complete + ", expanded=" + expanded + ", hidden="
                + hidden + (key != null ? ", key='" + key + "'" : "") + ", children=" + children.size() + "}";
    }
}
