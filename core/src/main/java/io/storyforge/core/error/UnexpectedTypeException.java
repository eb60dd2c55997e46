package io.storyforge.core.error;

/**
 * Thrown when an object handler is invoked on a value that is not a JSON object. URN: {@code
 * urn:storyforge:error:unexpected-type}
 */
public final class UnexpectedTypeException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:unexpected-type";

    public UnexpectedTypeException(String message, String ruleName, String fragment) {
        super(message, ruleName, fragment);
    }
}
