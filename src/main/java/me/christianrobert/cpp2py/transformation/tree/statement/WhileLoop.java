package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

public final class WhileLoop extends Node {

    private final Node condition;
    private final Block body;

    public WhileLoop(Node condition, Block body, SourceLocation location) {
        super(NodeKind.WHILE_LOOP, location, null);
        this.condition = Nodes.requireExpression(condition, "while-loop condition");
        this.body = Nodes.requireKind(body, Block.class, "while-loop body");
    }

    public Node getCondition() {
        return condition;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newCondition = mapper.apply(condition);
        Node newBody = mapper.apply(body);
        if (newCondition == condition && newBody == body) {
            return this;
        }
        return new WhileLoop(newCondition, Nodes.requireKind(newBody, Block.class, "while-loop body"), getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof WhileLoop)) {
            return false;
        }
        WhileLoop that = (WhileLoop) o;
        return condition.equals(that.condition) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.WHILE_LOOP, condition, body);
    }

    @Override
    public String toString() {
        return "WhileLoop{condition=" + condition + "}";
    }
}
