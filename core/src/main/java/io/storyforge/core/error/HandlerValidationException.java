package io.storyforge.core.error;

/**
 * Thrown by an object handler when the rule content it was given is malformed (missing or
 * mismatched {@code values}/{@code weights}, out-of-range {@code success-rate}). The expansion
 * engine recovers from it locally by substituting the undefined-rule placeholder. URN: {@code
 * urn:storyforge:error:handler-validation}
 */
public final class HandlerValidationException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:handler-validation";

    private final String handlerName;

    public HandlerValidationException(String message, String handlerName) {
        super(message, null, null);
        this.handlerName = handlerName;
    }

    /** Name of the handler that rejected its input. */
    public String handlerName() {
        return handlerName;
    }
}
