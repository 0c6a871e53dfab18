package me.christianrobert.cpp2py.transformation.tree.definition;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Root of one translation unit: the ordered top-level statements of the Python module.
 */
public final class Module extends Node {

    private final List<Node> body;

    public Module(List<? extends Node> body) {
        super(NodeKind.MODULE, null, null);
        this.body = Nodes.requireStatements(body, "module body");
    }

    public List<Node> getBody() {
        return body;
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }

    @Override
    public List<Node> getChildren() {
        return body;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        List<Node> newBody = mapList(body, mapper);
        if (newBody == body) {
            return this;
        }
        return new Module(newBody);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Module && body.equals(((Module) o).body);
    }

    @Override
    public int hashCode() {
        return body.hashCode();
    }

    @Override
    public String toString() {
        return "Module{statements=" + body.size() + "}";
    }
}
