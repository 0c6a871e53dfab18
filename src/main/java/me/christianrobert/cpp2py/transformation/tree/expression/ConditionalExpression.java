package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * {@code cond ? a : b}, rendered as {@code a if cond else b}.
 */
public final class ConditionalExpression extends Node {

    private final Node condition;
    private final Node whenTrue;
    private final Node whenFalse;

    public ConditionalExpression(Node condition, Node whenTrue, Node whenFalse,
                                 SourceLocation location, String inferredType) {
        super(NodeKind.CONDITIONAL_EXPRESSION, location, inferredType);
        this.condition = Nodes.requireExpression(condition, "conditional test");
        this.whenTrue = Nodes.requireExpression(whenTrue, "conditional true branch");
        this.whenFalse = Nodes.requireExpression(whenFalse, "conditional false branch");
    }

    public Node getCondition() {
        return condition;
    }

    public Node getWhenTrue() {
        return whenTrue;
    }

    public Node getWhenFalse() {
        return whenFalse;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(condition, whenTrue, whenFalse);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newCondition = mapper.apply(condition);
        Node newTrue = mapper.apply(whenTrue);
        Node newFalse = mapper.apply(whenFalse);
        if (newCondition == condition && newTrue == whenTrue && newFalse == whenFalse) {
            return this;
        }
        return new ConditionalExpression(newCondition, newTrue, newFalse, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ConditionalExpression)) {
            return false;
        }
        ConditionalExpression that = (ConditionalExpression) o;
        return condition.equals(that.condition) && whenTrue.equals(that.whenTrue) && whenFalse.equals(that.whenFalse);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, whenTrue, whenFalse);
    }

    @Override
    public String toString() {
        return "ConditionalExpression{" + whenTrue + " if " + condition + " else " + whenFalse + "}";
    }
}
