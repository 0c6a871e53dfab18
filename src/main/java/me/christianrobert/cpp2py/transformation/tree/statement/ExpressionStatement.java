package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * An expression evaluated for its side effects.
 */
public final class ExpressionStatement extends Node {

    private final Node expression;

    public ExpressionStatement(Node expression, SourceLocation location) {
        super(NodeKind.EXPRESSION_STATEMENT, location, null);
        this.expression = Nodes.requireExpression(expression, "expression statement");
    }

    public ExpressionStatement(Node expression) {
        this(expression, expression.getLocation());
    }

    public Node getExpression() {
        return expression;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(expression);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newExpression = mapper.apply(expression);
        if (newExpression == expression) {
            return this;
        }
        return new ExpressionStatement(newExpression, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpressionStatement && expression.equals(((ExpressionStatement) o).expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.EXPRESSION_STATEMENT, expression);
    }

    @Override
    public String toString() {
        return "ExpressionStatement{" + expression + "}";
    }
}
