package io.storyforge.core.engine;

import com.fasterxml.jackson.databind.node.TextNode;
import io.storyforge.core.error.GrammarException;
import io.storyforge.core.model.ParseNode;
import io.storyforge.core.model.ParseTree;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental depth-first expansion of a {@link ParseTree}, driven by an explicit stack of
 * in-progress nodes rather than recursion, so a caller can advance one node at a time and observe
 * intermediate state.
 *
 * <p>Each {@link #step()} expands the node on top of the stack. Incomplete children are pushed in
 * reverse so they are processed in document order. When a node has nothing left to expand it is
 * popped and its key (if any) is bound; popping then continues up the stack while the new top's
 * last expandable child is the node just popped, so a finished chain of ancestors unwinds in one
 * step and keys bind innermost first.
 *
 * <p>Not thread-safe: one engine per tree.
 */
public final class ExpansionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ExpansionEngine.class);

    private final ParseTree tree;
    private final Deque<ParseNode> expanding = new ArrayDeque<>();
    private int steps;

    public ExpansionEngine(ParseTree tree) {
        this.tree = tree;
    }

    /**
     * Performs one expansion step.
     *
     * @return {@code true} while unfinished nodes remain
     * @throws GrammarException with the failing node and its ancestors appended to its trace
     */
    public boolean step() {
        if (expanding.isEmpty()) {
            if (tree.root().isExpanded()) {
                return false;
            }
            expanding.push(tree.root());
        }

        ParseNode node = expanding.peek();
        ParseNode current = node;
        try {
            node.expand(tree.grammar().resolver(), tree.symbols());
            steps++;

            List<ParseNode> pending = node.incompleteChildren();
            if (pending.isEmpty()) {
                ParseNode popped = expanding.pop();
                current = popped;
                bindKey(popped);
                while (!expanding.isEmpty() && expanding.peek().lastExpandableChild() == popped) {
                    popped = expanding.pop();
                    current = popped;
                    bindKey(popped);
                }
            } else {
                for (int i = pending.size() - 1; i >= 0; i--) {
                    expanding.push(pending.get(i));
                }
            }
        } catch (GrammarException e) {
            throw traceAncestors(e, current);
        }
        return !expanding.isEmpty();
    }

    /** Returns {@code true} once the root has been expanded and the stack has drained. */
    public boolean isFinished() {
        return expanding.isEmpty() && tree.root().isExpanded();
    }

    public int steps() {
        return steps;
    }

    // The stack also holds siblings waiting their turn; only the ancestor chain belongs in the trace.
    private GrammarException traceAncestors(GrammarException e, ParseNode failing) {
        ParseNode current = failing;
        e.addFrame(current.text());
        for (ParseNode open : expanding) {
            if (open.children().contains(current)) {
                e.addFrame(open.text());
                current = open;
            }
        }
        return e;
    }

    private void bindKey(ParseNode node) {
        if (node.key().isEmpty()) {
            return;
        }
        String key = node.key().get();
        String value = node.flatten(tree, false, false);
        if (key.isEmpty()) {
            LOG.debug("expansion.discard fragment='{}'", node.text());
            return;
        }
        tree.symbols().push(key, TextNode.valueOf(value));
        LOG.debug("expansion.bind key={} value='{}'", key, value);
    }
}
