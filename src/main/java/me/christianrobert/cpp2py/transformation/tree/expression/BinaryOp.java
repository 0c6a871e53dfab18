package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Binary operation. Logical operators are stored in Python spelling ({@code and}, {@code or});
 * all others keep the C++ symbol, which coincides with Python's for the supported set.
 */
public final class BinaryOp extends Node {

    private final Node left;
    private final String operator;
    private final Node right;

    public BinaryOp(Node left, String operator, Node right, SourceLocation location, String inferredType) {
        super(NodeKind.BINARY_OP, location, inferredType);
        this.left = Nodes.requireExpression(left, "left operand");
        this.operator = Nodes.requireName(operator, "binary operator");
        this.right = Nodes.requireExpression(right, "right operand");
    }

    public BinaryOp(Node left, String operator, Node right) {
        this(left, operator, right, null, null);
    }

    public Node getLeft() {
        return left;
    }

    public String getOperator() {
        return operator;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(left, right);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newLeft = mapper.apply(left);
        Node newRight = mapper.apply(right);
        if (newLeft == left && newRight == right) {
            return this;
        }
        return new BinaryOp(newLeft, operator, newRight, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOp)) {
            return false;
        }
        BinaryOp that = (BinaryOp) o;
        return left.equals(that.left) && operator.equals(that.operator) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "BinaryOp{" + left + " " + operator + " " + right + "}";
    }
}
