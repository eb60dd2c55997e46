package io.storyforge.core.error;

/**
 * Thrown when a modifier rejects its input or parameters, for example a {@code replace} pattern
 * that is not a valid regular expression. The modifier's own exception is kept as the cause. URN:
 * {@code urn:storyforge:error:modifier-failed}
 */
public final class ModifierFailedException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:modifier-failed";

    private final String modifierName;

    public ModifierFailedException(String modifierName, Throwable cause, String ruleName, String fragment) {
        super(
                String.format("Modifier '%s' failed (rule '%s'): %s", modifierName, ruleName, cause.getMessage()),
                cause,
                ruleName,
                fragment);
        this.modifierName = modifierName;
    }

    /** Name of the modifier that failed. */
    public String modifierName() {
        return modifierName;
    }
}
