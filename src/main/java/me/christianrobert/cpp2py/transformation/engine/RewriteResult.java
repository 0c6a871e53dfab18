package me.christianrobert.cpp2py.transformation.engine;

import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.tree.Node;

import java.util.List;

/**
 * Outcome of running a rule set over a tree.
 */
public final class RewriteResult {

    private final Node tree;
    private final List<Diagnostic> diagnostics;
    private final int passes;
    private final int changes;
    private final boolean converged;

    public RewriteResult(Node tree, List<Diagnostic> diagnostics, int passes, int changes, boolean converged) {
        this.tree = tree;
        this.diagnostics = List.copyOf(diagnostics);
        this.passes = passes;
        this.changes = changes;
        this.converged = converged;
    }

    public Node getTree() {
        return tree;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Number of passes run.
     */
    public int getPasses() {
        return passes;
    }

    /**
     * Number of accepted rewrites over all passes.
     */
    public int getChanges() {
        return changes;
    }

    /**
     * True when the last pass changed nothing. Always reported for single-pass runs as
     * whether that pass was a no-op.
     */
    public boolean isConverged() {
        return converged;
    }
}
