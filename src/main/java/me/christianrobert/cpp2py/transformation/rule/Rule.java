package me.christianrobert.cpp2py.transformation.rule;

import me.christianrobert.cpp2py.transformation.tree.Node;

/**
 * A single tree rewrite.
 *
 * <p>The engine offers every node to every active rule, children before parents. A rule
 * that does not apply returns the node it was given. A rule that applies returns a
 * replacement node; the replacement is accepted only if it differs structurally from the
 * input. Rules must be pure: no state carried between calls, no mutation of the input.</p>
 *
 * <p>A rule should be idempotent on its own output so that fixed-point rewriting
 * converges: applying it to a node it produced must leave that node unchanged.</p>
 */
public interface Rule {

    /**
     * Stable name used to select the rule and to attribute diagnostics.
     */
    String getName();

    /**
     * One-line description shown by {@code --list-rules}.
     */
    default String getDescription() {
        return "";
    }

    /**
     * Returns the rewritten node, or {@code node} itself when the rule does not apply.
     */
    Node apply(Node node);
}
