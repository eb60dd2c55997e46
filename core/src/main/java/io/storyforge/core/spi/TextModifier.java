package io.storyforge.core.spi;

import java.util.List;

/**
 * Modifier over plain text: {@code (accumulated string, parameters) -> string}.
 *
 * @param arity declared parameter count
 * @param function the transformation
 */
public record TextModifier(int arity, TextModifier.Function function) implements Modifier {

    public TextModifier {
        Modifier.checkArity(arity, function);
    }

    /** Text transformation signature. */
    @FunctionalInterface
    public interface Function {
        String apply(String input, List<String> params);
    }
}
