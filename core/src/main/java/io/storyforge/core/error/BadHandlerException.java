package io.storyforge.core.error;

/**
 * Thrown when rule content is an object that lacks a {@code "handler"} field, names a handler
 * that is not registered, or whose handler returns something other than a string. URN: {@code
 * urn:storyforge:error:bad-handler}
 */
public final class BadHandlerException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:bad-handler";

    private final String handlerName;

    public BadHandlerException(String message, String handlerName, String ruleName, String fragment) {
        super(message, ruleName, fragment);
        this.handlerName = handlerName;
    }

    /** The handler name from the rule content, or {@code null} if the field was missing. */
    public String handlerName() {
        return handlerName;
    }
}
