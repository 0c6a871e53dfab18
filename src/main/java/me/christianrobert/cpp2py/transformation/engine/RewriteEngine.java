package me.christianrobert.cpp2py.transformation.engine;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.context.NonConvergenceException;
import me.christianrobert.cpp2py.transformation.context.RuleFailureException;
import me.christianrobert.cpp2py.transformation.context.StructuralException;
import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;
import me.christianrobert.cpp2py.transformation.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies a rule set to a tree.
 *
 * <p>One pass visits every node once, children before parents. At each node the rules
 * are tried in order and the first one that returns a structurally different node wins;
 * the remaining rules are not offered that node in this pass. Because children are
 * rewritten first, a rule sees its node's subtree in rewritten form.</p>
 *
 * <p>A rule that throws is isolated: the failure is recorded as a diagnostic and the node
 * is left as it was for the rest of the pass. In strict mode the failure aborts the
 * run with a {@link RuleFailureException}. A {@link StructuralException} (a rule built an
 * ill-formed node) is never isolated.</p>
 *
 * <p>The engine holds no state between calls and is safe to share.</p>
 */
@ApplicationScoped
public class RewriteEngine {

    private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);

    public RewriteResult rewrite(Node root, RuleSet rules, RewriteOptions options) {
        Set<Diagnostic> diagnostics = new LinkedHashSet<>();
        if (rules.isEmpty()) {
            return new RewriteResult(root, List.copyOf(diagnostics), 0, 0, true);
        }

        int maxPasses = options.isFixedPoint() ? options.getMaxPasses() : 1;
        Node current = root;
        int passes = 0;
        int totalChanges = 0;
        boolean converged = false;

        while (passes < maxPasses) {
            Pass pass = new Pass(rules, options.isStrict(), diagnostics);
            current = pass.visit(current);
            passes++;
            totalChanges += pass.changes;
            log.debug("Rewrite pass {} applied {} change(s)", passes, pass.changes);
            if (pass.changes == 0) {
                converged = true;
                break;
            }
        }

        if (options.isFixedPoint() && !converged) {
            if (options.isStrict()) {
                throw new NonConvergenceException(passes);
            }
            log.warn("Rewriting did not converge after {} passes", passes);
            diagnostics.add(Diagnostic.nonConvergence(passes));
        }
        return new RewriteResult(current, List.copyOf(diagnostics), passes, totalChanges, converged);
    }

    /**
     * State of a single traversal.
     */
    private static final class Pass {
        private final RuleSet rules;
        private final boolean strict;
        private final Set<Diagnostic> diagnostics;
        private int changes;

        Pass(RuleSet rules, boolean strict, Set<Diagnostic> diagnostics) {
            this.rules = rules;
            this.strict = strict;
            this.diagnostics = diagnostics;
        }

        Node visit(Node node) {
            Node rebuilt = node.mapChildren(this::visit);
            return applyFirstMatch(rebuilt);
        }

        private Node applyFirstMatch(Node node) {
            for (Rule rule : rules.getRules()) {
                Node result;
                try {
                    result = rule.apply(node);
                    if (result == null) {
                        throw new IllegalStateException("rule returned no node");
                    }
                } catch (StructuralException e) {
                    throw e;
                } catch (RuntimeException e) {
                    if (strict) {
                        throw new RuleFailureException(rule.getName(), node.getLocation(), e);
                    }
                    log.warn("Rule {} failed on {} at {}: {}", rule.getName(), node.getKind(),
                            node.getLocation(), e.getMessage());
                    diagnostics.add(Diagnostic.ruleFailure(rule.getName(),
                            "failed on " + node.getKind() + ": " + e.getMessage(), node.getLocation()));
                    return node;
                }
                if (result != node && !result.equals(node)) {
                    changes++;
                    return result;
                }
            }
            return node;
        }
    }
}
