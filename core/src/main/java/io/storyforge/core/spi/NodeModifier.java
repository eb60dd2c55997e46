package io.storyforge.core.spi;

import io.storyforge.core.model.ParseNode;
import java.util.List;

/**
 * Modifier over the single node it is attached to: {@code (node, rule name, parameters) ->
 * string}. Like {@link TreeModifier}, invoked at most once per node.
 *
 * @param arity declared parameter count
 * @param function the node operation
 */
public record NodeModifier(int arity, NodeModifier.Function function) implements Modifier {

    public NodeModifier {
        Modifier.checkArity(arity, function);
    }

    /** Node operation signature. */
    @FunctionalInterface
    public interface Function {
        String apply(ParseNode node, String ruleName, List<String> params);
    }
}
