package me.christianrobert.cpp2py.transformation.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Base class of all internal tree nodes.
 *
 * <p>Nodes are immutable values. A node owns its children through fixed, typed slots
 * (for example a for-loop has init/condition/step/body). The only way to "change" a
 * node is to construct a new one; {@link #mapChildren(UnaryOperator)} does that while
 * keeping the instance when no child changed, which lets the rewrite engine detect
 * untouched subtrees cheaply.</p>
 *
 * <p>Equality is structural: kind, attributes and children. Source location and
 * inferred type are metadata and are ignored by {@code equals}/{@code hashCode}.</p>
 */
public abstract class Node {

    private final NodeKind kind;
    private final SourceLocation location;
    private final String inferredType;

    protected Node(NodeKind kind, SourceLocation location, String inferredType) {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null");
        }
        this.kind = kind;
        this.location = location;
        this.inferredType = inferredType;
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * Location of the originating C++ construct, or null for synthesized nodes.
     */
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Best-effort C++ type of an expression (e.g. "int", "std::string"), or null when unknown.
     */
    public String getInferredType() {
        return inferredType;
    }

    /**
     * Present children in slot order. Absent optional slots are skipped.
     */
    public abstract List<Node> getChildren();

    /**
     * Applies {@code mapper} to every present child and rebuilds this node from the results.
     *
     * @return this instance if every child came back identical, a new validated node otherwise
     * @throws me.christianrobert.cpp2py.transformation.context.StructuralException if a
     *         replacement child does not fit its slot
     */
    public abstract Node mapChildren(UnaryOperator<Node> mapper);

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    // ========== helpers for subclasses ==========

    protected static Node mapOptional(Node child, UnaryOperator<Node> mapper) {
        return child == null ? null : mapper.apply(child);
    }

    /**
     * Maps a child list; returns the original list instance when nothing changed.
     */
    protected static List<Node> mapList(List<? extends Node> children, UnaryOperator<Node> mapper) {
        List<Node> mapped = new ArrayList<>(children.size());
        boolean changed = false;
        for (Node child : children) {
            Node result = mapper.apply(child);
            if (result != child) {
                changed = true;
            }
            mapped.add(result);
        }
        if (!changed) {
            @SuppressWarnings("unchecked")
            List<Node> same = (List<Node>) children;
            return same;
        }
        return mapped;
    }

    protected static List<Node> concat(List<? extends Node> first, List<? extends Node> second) {
        List<Node> all = new ArrayList<>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}
