package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Tuple display. Used as an assignment target for multi-value reads and as the argument tuple of {@code %} formatting.
 */
public final class TupleLiteral extends Node {

    private final List<Node> elements;

    public TupleLiteral(List<? extends Node> elements, SourceLocation location, String inferredType) {
        super(NodeKind.TUPLE_LITERAL, location, inferredType);
        this.elements = Nodes.requireExpressions(elements, "tuple element");
    }

    public TupleLiteral(List<? extends Node> elements) {
        this(elements, null, null);
    }

    public List<Node> getElements() {
        return elements;
    }

    @Override
    public List<Node> getChildren() {
        return elements;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        List<Node> newElements = mapList(elements, mapper);
        if (newElements == elements) {
            return this;
        }
        return new TupleLiteral(newElements, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TupleLiteral && elements.equals(((TupleLiteral) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.TUPLE_LITERAL, elements);
    }

    @Override
    public String toString() {
        return "TupleLiteral{elements=" + elements.size() + "}";
    }
}
