package io.storyforge.core.engine;

import io.storyforge.core.spi.ExpansionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link ExpansionListener}: reports grammar warnings through SLF4J. */
public final class LoggingExpansionListener implements ExpansionListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingExpansionListener.class);

    @Override
    public void onUndefinedRule(UndefinedRuleEvent event) {
        LOG.warn("expansion.undefined_rule rule={} fragment='{}'", event.ruleName(), event.fragment());
    }

    @Override
    public void onUnknownModifier(UnknownModifierEvent event) {
        LOG.warn(
                "expansion.unknown_modifier modifier={} rule={} fragment='{}'",
                event.modifierName(),
                event.ruleName(),
                event.fragment());
    }

    @Override
    public void onHandlerRejected(HandlerRejectedEvent event) {
        LOG.warn(
                "expansion.handler_rejected rule={} handler={} detail='{}'",
                event.ruleName(),
                event.handlerName(),
                event.detail());
    }

    @Override
    public void onTreeExpanded(TreeExpandedEvent event) {
        LOG.debug("expansion.complete start='{}' steps={}", event.start(), event.steps());
    }
}
