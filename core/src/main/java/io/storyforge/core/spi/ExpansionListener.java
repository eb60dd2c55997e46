package io.storyforge.core.spi;

/**
 * Warning channel for non-fatal grammar problems. The engine keeps going after each of these (an
 * undefined rule renders as {@code {{name}}}, an unknown modifier is skipped), so a listener is
 * the only place a grammar typo becomes visible.
 *
 * <p>Exceptions thrown by listeners are caught by the engine and logged; they do NOT affect
 * expansion.
 */
public interface ExpansionListener {

    /**
     * Called when a rule reference resolves neither in the symbol table nor in the grammar.
     *
     * @param event contains ruleName, fragment
     */
    void onUndefinedRule(UndefinedRuleEvent event);

    /**
     * Called when a node carries a modifier name that is not registered.
     *
     * @param event contains modifierName, ruleName, fragment
     */
    void onUnknownModifier(UnknownModifierEvent event);

    /**
     * Called when an object handler rejects malformed rule content.
     *
     * @param event contains ruleName, handlerName, detail
     */
    void onHandlerRejected(HandlerRejectedEvent event);

    /**
     * Called when a tree has been fully expanded.
     *
     * @param event contains start text and the number of expansion steps taken
     */
    void onTreeExpanded(TreeExpandedEvent event);

    // --- Event records ---

    /** Event emitted for an undefined rule reference. */
    record UndefinedRuleEvent(String ruleName, String fragment) {}

    /** Event emitted for an unregistered modifier name. */
    record UnknownModifierEvent(String modifierName, String ruleName, String fragment) {}

    /** Event emitted when a handler rejects its rule content. */
    record HandlerRejectedEvent(String ruleName, String handlerName, String detail) {}

    /** Event emitted when expansion of a tree completes. */
    record TreeExpandedEvent(String start, int steps) {}
}
