package io.storyforge.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.storyforge.core.engine.distribution.DistributionHandlers;
import io.storyforge.core.error.ExpansionBudgetExceededException;
import io.storyforge.core.model.ParseTree;
import io.storyforge.core.model.SymbolTable;
import io.storyforge.core.spi.ExpansionListener;
import io.storyforge.core.spi.ExpansionListener.HandlerRejectedEvent;
import io.storyforge.core.spi.ExpansionListener.TreeExpandedEvent;
import io.storyforge.core.spi.ExpansionListener.UndefinedRuleEvent;
import io.storyforge.core.spi.ExpansionListener.UnknownModifierEvent;
import io.storyforge.core.spi.Modifier;
import io.storyforge.core.spi.ObjectHandler;
import io.storyforge.core.spi.RandomSource;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A generative grammar: named rules plus the modifier and object-handler registries and the
 * randomness source used to expand them.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * Grammar grammar = new Grammar(rules);
 * grammar.addModifiers(EnglishModifiers.create());
 * String story = grammar.flatten("#origin#");
 * }</pre>
 *
 * <p>The rules are immutable for the grammar's lifetime. The built-in distribution handlers are
 * registered at construction; modifiers are added by the caller. Registries are read-only once
 * expansion begins; complete registration before sharing a grammar across threads. Each {@link
 * ParseTree} owns its own symbol table, so independent trees may expand concurrently, provided the
 * {@link RandomSource} is itself thread-safe.
 */
public final class Grammar {

    private static final Logger LOG = LoggerFactory.getLogger(Grammar.class);

    private final ObjectNode rules;
    private final RandomSource random;
    private final ExpansionBudget budget;
    private final ExpansionListener listener;
    private final ModifierRegistry modifiers = new ModifierRegistry();
    private final ObjectHandlerRegistry objectHandlers = new ObjectHandlerRegistry();
    private final RuleResolver resolver;

    /** Creates a grammar with no rules. */
    public Grammar() {
        this(null);
    }

    /**
     * Creates a grammar with an unseeded random source.
     *
     * @param rules object mapping rule name to content; {@code null} means no rules
     */
    public Grammar(JsonNode rules) {
        this(rules, new DefaultRandomSource());
    }

    /**
     * Creates a grammar with the given random source, the default budget and a logging listener.
     *
     * @param rules object mapping rule name to content; {@code null} means no rules
     * @param random source for alternative selection and object handlers
     */
    public Grammar(JsonNode rules, RandomSource random) {
        this(rules, random, ExpansionBudget.DEFAULT, new LoggingExpansionListener());
    }

    /**
     * Creates a grammar with all configuration options.
     *
     * @param rules object mapping rule name to content; {@code null} means no rules
     * @param random source for alternative selection and object handlers
     * @param budget step budget for {@link #expandFully}
     * @param listener warning channel for undefined rules, unknown modifiers and rejected handler
     *     content
     * @throws IllegalArgumentException if {@code rules} is neither null, missing, nor an object
     */
    public Grammar(JsonNode rules, RandomSource random, ExpansionBudget budget, ExpansionListener listener) {
        this.rules = toRules(rules);
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.objectHandlers.registerAll(DistributionHandlers.create());
        this.resolver = new RuleResolver(this);
    }

    private static ObjectNode toRules(JsonNode rules) {
        if (rules == null || rules.isNull() || rules.isMissingNode()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!rules.isObject()) {
            throw new IllegalArgumentException("grammar rules must be a JSON object, got: " + rules.getNodeType());
        }
        return ((ObjectNode) rules).deepCopy();
    }

    // --- Expansion ---

    /**
     * Creates an unexpanded tree for {@code start} with an empty symbol table.
     *
     * @param start the start fragment, e.g. {@code "#origin#"}
     */
    public ParseTree getTree(String start) {
        return getTree(start, new SymbolTable());
    }

    /**
     * Creates an unexpanded tree whose symbol table starts as a copy of {@code bindings}.
     *
     * @param start the start fragment
     * @param bindings initial key bindings; not modified
     */
    public ParseTree getTree(String start, SymbolTable bindings) {
        return new ParseTree(this, start, bindings.copy());
    }

    /**
     * Steps {@code tree} until no work remains.
     *
     * @return the same tree, fully expanded
     * @throws ExpansionBudgetExceededException if the step budget runs out first
     */
    public ParseTree expandFully(ParseTree tree) {
        while (tree.step()) {
            if (tree.steps() >= budget.maxSteps()) {
                throw new ExpansionBudgetExceededException(
                        "Expansion did not converge within " + budget.maxSteps()
                                + " steps; the grammar is probably self-referential",
                        tree.root().text());
            }
        }
        notifyTreeExpanded(new TreeExpandedEvent(tree.root().text(), tree.steps()));
        return tree;
    }

    /**
     * Builds, fully expands and flattens a tree for {@code start}, with hidden nodes suppressed.
     *
     * @param start the start fragment
     * @return the generated text
     */
    public String flatten(String start) {
        return expandFully(getTree(start)).flatten();
    }

    // --- Registries ---

    /** Registers a modifier, replacing any modifier of the same name. */
    public void addModifier(String name, Modifier modifier) {
        modifiers.register(name, modifier);
    }

    /** Registers every modifier in {@code entries}. */
    public void addModifiers(Map<String, ? extends Modifier> entries) {
        modifiers.registerAll(entries);
    }

    /** Registers an object handler, replacing any handler of the same name. */
    public void addObjectHandler(String name, ObjectHandler handler) {
        objectHandlers.register(name, handler);
    }

    public ModifierRegistry modifiers() {
        return modifiers;
    }

    public ObjectHandlerRegistry objectHandlers() {
        return objectHandlers;
    }

    // --- Accessors ---

    /** Static content of rule {@code name}, or empty if the grammar does not define it. */
    public Optional<JsonNode> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    /** Read-only copy of all rules. */
    public ObjectNode rules() {
        return rules.deepCopy();
    }

    public RandomSource random() {
        return random;
    }

    public ExpansionBudget budget() {
        return budget;
    }

    public ExpansionListener listener() {
        return listener;
    }

    /** Resolver used by nodes to turn rule names into text. */
    public RuleResolver resolver() {
        return resolver;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they MUST NOT affect expansion.

    void notifyUndefinedRule(UndefinedRuleEvent event) {
        try {
            listener.onUndefinedRule(event);
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onUndefinedRule failed", e);
        }
    }

    void notifyUnknownModifier(UnknownModifierEvent event) {
        try {
            listener.onUnknownModifier(event);
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onUnknownModifier failed", e);
        }
    }

    void notifyHandlerRejected(HandlerRejectedEvent event) {
        try {
            listener.onHandlerRejected(event);
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onHandlerRejected failed", e);
        }
    }

    void notifyTreeExpanded(TreeExpandedEvent event) {
        try {
            listener.onTreeExpanded(event);
        } catch (Exception e) {
            LOG.warn("ExpansionListener.onTreeExpanded failed", e);
        }
    }
}
