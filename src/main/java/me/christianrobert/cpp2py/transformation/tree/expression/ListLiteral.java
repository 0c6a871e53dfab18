package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * List display {@code [a, b]}, from C++ braced initializer lists.
 */
public final class ListLiteral extends Node {

    private final List<Node> elements;

    public ListLiteral(List<? extends Node> elements, SourceLocation location, String inferredType) {
        super(NodeKind.LIST_LITERAL, location, inferredType);
        this.elements = Nodes.requireExpressions(elements, "list element");
    }

    public ListLiteral(List<? extends Node> elements) {
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
        return new ListLiteral(newElements, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListLiteral && elements.equals(((ListLiteral) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.LIST_LITERAL, elements);
    }

    @Override
    public String toString() {
        return "ListLiteral{elements=" + elements.size() + "}";
    }
}
