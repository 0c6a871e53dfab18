package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public final class Subscript extends Node {

    private final Node value;
    private final Node index;

    public Subscript(Node value, Node index, SourceLocation location, String inferredType) {
        super(NodeKind.SUBSCRIPT, location, inferredType);
        this.value = Nodes.requireExpression(value, "subscripted value");
        this.index = Nodes.requireExpression(index, "subscript index");
    }

    public Node getValue() {
        return value;
    }

    public Node getIndex() {
        return index;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(value, index);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newValue = mapper.apply(value);
        Node newIndex = mapper.apply(index);
        if (newValue == value && newIndex == index) {
            return this;
        }
        return new Subscript(newValue, newIndex, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Subscript)) {
            return false;
        }
        Subscript that = (Subscript) o;
        return value.equals(that.value) && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.SUBSCRIPT, value, index);
    }

    @Override
    public String toString() {
        return "Subscript{" + value + "[" + index + "]}";
    }
}
