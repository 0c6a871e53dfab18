package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Loop whose body runs before the condition is first tested.
 */
public final class DoWhileLoop extends Node {

    private final Block body;
    private final Node condition;

    public DoWhileLoop(Block body, Node condition, SourceLocation location) {
        super(NodeKind.DO_WHILE_LOOP, location, null);
        this.body = Nodes.requireKind(body, Block.class, "do-while body");
        this.condition = Nodes.requireExpression(condition, "do-while condition");
    }

    public Block getBody() {
        return body;
    }

    public Node getCondition() {
        return condition;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(body, condition);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newBody = mapper.apply(body);
        Node newCondition = mapper.apply(condition);
        if (newBody == body && newCondition == condition) {
            return this;
        }
        return new DoWhileLoop(Nodes.requireKind(newBody, Block.class, "do-while body"), newCondition, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DoWhileLoop)) {
            return false;
        }
        DoWhileLoop that = (DoWhileLoop) o;
        return body.equals(that.body) && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.DO_WHILE_LOOP, body, condition);
    }

    @Override
    public String toString() {
        return "DoWhileLoop{condition=" + condition + "}";
    }
}
