package io.storyforge.core.spi;

import java.util.function.UnaryOperator;

/**
 * A named post-processing function applied to a node's flattened text. Every modifier declares a
 * fixed parameter arity (excluding its input) and exactly one input kind, expressed by which of
 * the three variants implements it:
 *
 * <ul>
 *   <li>{@link TextModifier}: receives the accumulated string
 *   <li>{@link TreeModifier}: receives the owning parse tree, for side effects on its symbol table
 *   <li>{@link NodeModifier}: receives the node the modifier is attached to
 * </ul>
 *
 * <p>Tree and node modifiers conventionally return the empty string.
 */
public interface Modifier {

    /** Number of literal parameters the modifier expects, e.g. 2 for {@code replace(a,b)}. */
    int arity();

    /** Creates a zero-parameter text modifier. */
    static TextModifier text(UnaryOperator<String> function) {
        return new TextModifier(0, (input, params) -> function.apply(input));
    }

    /** Creates a text modifier taking {@code arity} parameters. */
    static TextModifier text(int arity, TextModifier.Function function) {
        return new TextModifier(arity, function);
    }

    /** Creates a tree modifier taking {@code arity} parameters. */
    static TreeModifier tree(int arity, TreeModifier.Function function) {
        return new TreeModifier(arity, function);
    }

    /** Creates a node modifier taking {@code arity} parameters. */
    static NodeModifier node(int arity, NodeModifier.Function function) {
        return new NodeModifier(arity, function);
    }

    /** Shared argument validation for the variant records. */
    static void checkArity(int arity, Object function) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative, got: " + arity);
        }
        if (function == null) {
            throw new NullPointerException("function must not be null");
        }
    }
}
