package io.storyforge.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base for all storyforge exceptions. Never thrown directly; use the concrete subclasses
 * under {@link GrammarLoadException} or {@link ExpansionException}.
 *
 * <p>While an exception propagates up through nested {@code flatten} calls, each enclosing node
 * appends its fragment via {@link #addFrame(String)}, so the rendered message traces the full
 * nesting from the failing fragment outwards.
 */
public abstract class GrammarException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXPANSION
    }

    private final String ruleName;
    private final String fragment;
    private final Phase phase;
    private final List<String> trace = new ArrayList<>();

    protected GrammarException(String message, String ruleName, String fragment, Phase phase) {
        super(message);
        this.ruleName = ruleName;
        this.fragment = fragment;
        this.phase = phase;
    }

    protected GrammarException(String message, Throwable cause, String ruleName, String fragment, Phase phase) {
        super(message, cause);
        this.ruleName = ruleName;
        this.fragment = fragment;
        this.phase = phase;
    }

    /** The rule in scope when the error occurred, or {@code null} if not identified. */
    public String ruleName() {
        return ruleName;
    }

    /** The grammar fragment that triggered the error, or {@code null} if not identified. */
    public String fragment() {
        return fragment;
    }

    /** Human-readable error description without the nesting trace. */
    public String detail() {
        return super.getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Enclosing fragments, innermost first. */
    public List<String> trace() {
        return Collections.unmodifiableList(trace);
    }

    /**
     * Records an enclosing fragment. Consecutive duplicates are collapsed and the failing fragment
     * itself is not repeated.
     *
     * @param enclosingFragment the text of the node the exception is passing through
     * @return this exception, for rethrowing
     */
    public GrammarException addFrame(String enclosingFragment) {
        String last = trace.isEmpty() ? fragment : trace.get(trace.size() - 1);
        if (!enclosingFragment.equals(last)) {
            trace.add(enclosingFragment);
        }
        return this;
    }

    @Override
    public String getMessage() {
        if (trace.isEmpty()) {
            return super.getMessage();
        }
        StringBuilder sb = new StringBuilder(super.getMessage());
        for (String frame : trace) {
            sb.append("\n  in '").append(frame).append('\'');
        }
        return sb.toString();
    }
}
