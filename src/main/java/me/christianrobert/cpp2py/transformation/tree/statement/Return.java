package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public final class Return extends Node {

    private final Node value;

    public Return(Node value, SourceLocation location) {
        super(NodeKind.RETURN, location, null);
        this.value = Nodes.optionalExpression(value, "return value");
    }

    public Node getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newValue = mapOptional(value, mapper);
        if (newValue == value) {
            return this;
        }
        return new Return(newValue, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Return && Objects.equals(value, ((Return) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.RETURN, value);
    }

    @Override
    public String toString() {
        return "Return{value=" + value + "}";
    }
}
