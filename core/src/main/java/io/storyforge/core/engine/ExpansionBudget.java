package io.storyforge.core.engine;

/**
 * Step budget for full expansion of a tree. Guards against grammars that reference themselves
 * without a terminating alternative, which would otherwise never converge.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxSteps maximum number of expansion steps for one tree (default: 100 000)
 */
public record ExpansionBudget(int maxSteps) {

    /** Default budget: 100 000 steps. */
    public static final ExpansionBudget DEFAULT = new ExpansionBudget(100_000);

    public ExpansionBudget {
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("maxSteps must be positive, got: " + maxSteps);
        }
    }
}
