package io.storyforge.core.error;

/**
 * Thrown when grammar source has invalid JSON/YAML syntax or a rule whose content has the wrong
 * shape. URN: {@code urn:storyforge:error:grammar-parse-failed}
 */
public final class GrammarParseException extends GrammarLoadException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:grammar-parse-failed";

    public GrammarParseException(String message, String ruleName, String source) {
        super(message, ruleName, source);
    }

    public GrammarParseException(String message, Throwable cause, String ruleName, String source) {
        super(message, cause, ruleName, source);
    }
}
