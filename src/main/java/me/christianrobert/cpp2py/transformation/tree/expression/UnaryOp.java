package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Unary operation: {@code -}, {@code +}, {@code ~}, {@code not}, or an increment/decrement
 * ({@code ++}/{@code --}, prefix or postfix) that no rule has removed yet.
 */
public final class UnaryOp extends Node {

    private final String operator;
    private final Node operand;
    private final boolean postfix;

    public UnaryOp(String operator, Node operand, boolean postfix, SourceLocation location, String inferredType) {
        super(NodeKind.UNARY_OP, location, inferredType);
        this.operator = Nodes.requireName(operator, "unary operator");
        this.operand = Nodes.requireExpression(operand, "unary operand");
        this.postfix = postfix;
    }

    public String getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public boolean isIncrementOrDecrement() {
        return "++".equals(operator) || "--".equals(operator);
    }

    @Override
    public List<Node> getChildren() {
        return List.of(operand);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newOperand = mapper.apply(operand);
        if (newOperand == operand) {
            return this;
        }
        return new UnaryOp(operator, newOperand, postfix, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOp)) {
            return false;
        }
        UnaryOp that = (UnaryOp) o;
        return postfix == that.postfix && operator.equals(that.operator) && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand, postfix);
    }

    @Override
    public String toString() {
        return "UnaryOp{" + (postfix ? operand + operator : operator + operand) + "}";
    }
}
