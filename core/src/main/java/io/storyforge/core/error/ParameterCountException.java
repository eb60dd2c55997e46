package io.storyforge.core.error;

/**
 * Thrown when a modifier is invoked with a parameter count that does not match its declared
 * arity. URN: {@code urn:storyforge:error:parameter-count}
 */
public final class ParameterCountException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:parameter-count";

    private final String modifierName;
    private final int expected;
    private final int actual;

    public ParameterCountException(String modifierName, int expected, int actual, String ruleName, String fragment) {
        super(
                String.format(
                        "Modifier '%s' expects %d parameter(s) but was given %d (rule '%s')",
                        modifierName, expected, actual, ruleName),
                ruleName,
                fragment);
        this.modifierName = modifierName;
        this.expected = expected;
        this.actual = actual;
    }

    /** Name of the modifier that was invoked. */
    public String modifierName() {
        return modifierName;
    }

    /** Declared arity of the modifier. */
    public int expected() {
        return expected;
    }

    /** Number of parameters the grammar supplied. */
    public int actual() {
        return actual;
    }
}
