package io.storyforge.core.spi;

import io.storyforge.core.model.ParseTree;
import java.util.List;

/**
 * Modifier over the whole parse tree: {@code (tree, rule name, parameters) -> string}. Used for
 * side effects on the tree's symbol table, e.g. {@code pop!!}. Invoked at most once per node; the
 * recorded result is reused when the node is flattened again.
 *
 * @param arity declared parameter count
 * @param function the side-effecting operation
 */
public record TreeModifier(int arity, TreeModifier.Function function) implements Modifier {

    public TreeModifier {
        Modifier.checkArity(arity, function);
    }

    /** Tree operation signature. */
    @FunctionalInterface
    public interface Function {
        String apply(ParseTree tree, String ruleName, List<String> params);
    }
}
