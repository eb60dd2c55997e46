package io.storyforge.core.error;

/**
 * Abstract parent for errors raised while expanding or flattening a parse tree. These are
 * structural grammar errors: they abort the enclosing flatten operation and are never retried.
 */
public abstract class ExpansionException extends GrammarException {

    private static final long serialVersionUID = 1L;

    protected ExpansionException(String message, String ruleName, String fragment) {
        super(message, ruleName, fragment, Phase.EXPANSION);
    }

    protected ExpansionException(String message, Throwable cause, String ruleName, String fragment) {
        super(message, cause, ruleName, fragment, Phase.EXPANSION);
    }
}
