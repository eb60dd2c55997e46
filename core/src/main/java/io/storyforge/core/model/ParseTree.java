package io.storyforge.core.model;

import io.storyforge.core.engine.ExpansionEngine;
import io.storyforge.core.engine.Grammar;
import java.util.Objects;

/**
 * A single expansion of a start fragment against a {@link Grammar}. Owns the root node, a private
 * {@link SymbolTable}, and the {@link ExpansionEngine} holding the stack of in-progress nodes.
 *
 * <p>Created per expansion request by {@link Grammar#getTree(String)}, flattened, and discarded.
 * Not thread-safe; independent trees of the same grammar may be expanded concurrently.
 */
public final class ParseTree {

    private final Grammar grammar;
    private final ParseNode root;
    private final SymbolTable symbols;
    private final ExpansionEngine engine;

    /**
     * Creates an unexpanded tree.
     *
     * @param grammar the grammar supplying rules, registries and randomness
     * @param start the start fragment, e.g. {@code "#origin#"}
     * @param symbols initial bindings; the tree takes ownership of this table
     */
    public ParseTree(Grammar grammar, String start, SymbolTable symbols) {
        this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
        this.root = new ParseNode(start);
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");
        this.engine = new ExpansionEngine(this);
    }

    /**
     * Performs one expansion step.
     *
     * @return {@code true} while unfinished nodes remain
     */
    public boolean step() {
        return engine.step();
    }

    /** Returns {@code true} once no further steps are needed. */
    public boolean isExpanded() {
        return engine.isFinished();
    }

    /** Number of expansion steps performed so far. */
    public int steps() {
        return engine.steps();
    }

    /** Flattens for final output: hidden nodes suppressed, modifiers applied. */
    public String flatten() {
        return flatten(true, false);
    }

    /**
     * Serializes the (possibly partially expanded) tree.
     *
     * @param ignoreHidden suppress hidden nodes
     * @param ignoreModifiers skip the root's own modifiers
     */
    public String flatten(boolean ignoreHidden, boolean ignoreModifiers) {
        return root.flatten(this, ignoreHidden, ignoreModifiers);
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParseNode root() {
        return root;
    }

    public SymbolTable symbols() {
        return symbols;
    }
}
