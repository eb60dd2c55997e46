package io.storyforge.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.storyforge.core.error.HandlerValidationException;
import io.storyforge.core.model.SymbolTable;
import io.storyforge.core.spi.ExpansionListener.HandlerRejectedEvent;
import io.storyforge.core.spi.ExpansionListener.UndefinedRuleEvent;
import java.util.Optional;

/**
 * Turns a rule name into the text a rule reference expands to. The symbol table is consulted first
 * (runtime bindings shadow static rules), then the grammar. Content is converted to text by shape:
 *
 * <ul>
 *   <li>string, number, boolean: verbatim
 *   <li>array: one element picked uniformly, converted again (empty array gives "")
 *   <li>object: sampled through the object handler named by its {@code "handler"} field
 * </ul>
 *
 * <p>A rule defined nowhere, or whose handler rejects malformed content, renders as the visible
 * placeholder {@code {{name}}} and is reported to the grammar's listener.
 */
public final class RuleResolver {

    private final Grammar grammar;
    private final RandomSelector selector;

    RuleResolver(Grammar grammar) {
        this.grammar = grammar;
        this.selector = new RandomSelector(grammar.random());
    }

    /** Placeholder rendered in place of an unresolvable rule. */
    public static String placeholder(String ruleName) {
        return "{{" + ruleName + "}}";
    }

    /**
     * Resolves {@code ruleName} to text.
     *
     * @param ruleName the referenced rule
     * @param symbols the tree's symbol table
     * @param fragment the fragment being expanded, for diagnostics
     * @return the rule's output text
     * @throws io.storyforge.core.error.BadHandlerException if object content names no usable
     *     handler or the handler does not return a string
     */
    public String resolve(String ruleName, SymbolTable symbols, String fragment) {
        Optional<JsonNode> content = symbols.lookup(ruleName).or(() -> grammar.rule(ruleName));
        if (content.isEmpty() || content.get().isNull()) {
            grammar.notifyUndefinedRule(new UndefinedRuleEvent(ruleName, fragment));
            return placeholder(ruleName);
        }
        try {
            return toText(content.get(), ruleName, fragment);
        } catch (HandlerValidationException e) {
            grammar.notifyHandlerRejected(new HandlerRejectedEvent(ruleName, e.handlerName(), e.detail()));
            return placeholder(ruleName);
        }
    }

    private String toText(JsonNode content, String ruleName, String fragment) {
        if (content.isArray()) {
            Optional<JsonNode> picked = selector.pick(content);
            return picked.isPresent() ? toText(picked.get(), ruleName, fragment) : "";
        }
        if (content.isObject()) {
            return grammar.objectHandlers().sample(content, grammar.random(), ruleName, fragment);
        }
        if (content.isNull()) {
            return "";
        }
        return content.asText();
    }
}
