package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Iteration over a container, from a C++ range-based for.
 */
public final class ForEach extends Node {

    private final String target;
    private final Node iterable;
    private final Block body;

    public ForEach(String target, Node iterable, Block body, SourceLocation location) {
        super(NodeKind.FOR_EACH, location, null);
        this.target = Nodes.requireName(target, "for-each target");
        this.iterable = Nodes.requireExpression(iterable, "for-each iterable");
        this.body = Nodes.requireKind(body, Block.class, "for-each body");
    }

    public String getTarget() {
        return target;
    }

    public Node getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(iterable, body);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newIterable = mapper.apply(iterable);
        Node newBody = mapper.apply(body);
        if (newIterable == iterable && newBody == body) {
            return this;
        }
        return new ForEach(target, newIterable, Nodes.requireKind(newBody, Block.class, "for-each body"), getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ForEach)) {
            return false;
        }
        ForEach that = (ForEach) o;
        return target.equals(that.target) && iterable.equals(that.iterable) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, iterable, body);
    }

    @Override
    public String toString() {
        return "ForEach{target='" + target + "', iterable=" + iterable + "}";
    }
}
