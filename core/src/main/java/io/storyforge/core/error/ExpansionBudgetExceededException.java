package io.storyforge.core.error;

/**
 * Thrown when full expansion of a tree exceeds the configured step budget, which in practice
 * means the grammar references itself without a terminating alternative. URN: {@code
 * urn:storyforge:error:expansion-budget-exceeded}
 */
public final class ExpansionBudgetExceededException extends ExpansionException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:storyforge:error:expansion-budget-exceeded";

    public ExpansionBudgetExceededException(String message, String fragment) {
        super(message, null, fragment);
    }
}
