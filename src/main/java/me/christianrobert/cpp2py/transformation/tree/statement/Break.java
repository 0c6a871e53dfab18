package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.function.UnaryOperator;

public final class Break extends Node {

    public Break(SourceLocation location) {
        super(NodeKind.BREAK, location, null);
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Break;
    }

    @Override
    public int hashCode() {
        return NodeKind.BREAK.hashCode();
    }

    @Override
    public String toString() {
        return "Break{}";
    }
}
