package io.storyforge.core.error;

/**
 * Abstract parent for load-time grammar errors. Thrown while reading grammar source into a
 * structured value. Carries an additional {@code source} field identifying the file or resource
 * that caused the error.
 */
public abstract class GrammarLoadException extends GrammarException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected GrammarLoadException(String message, String ruleName, String source) {
        super(message, ruleName, null, Phase.LOAD);
        this.source = source;
    }

    protected GrammarLoadException(String message, Throwable cause, String ruleName, String source) {
        super(message, cause, ruleName, null, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
