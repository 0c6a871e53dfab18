package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * C++ cast ({@code (int) x}, {@code static_cast<double>(x)}). The target type is the
 * normalized C++ spelling and doubles as the inferred type of the expression.
 */
public final class Cast extends Node {

    private final String targetType;
    private final Node operand;

    public Cast(String targetType, Node operand, SourceLocation location) {
        super(NodeKind.CAST, location, targetType);
        this.targetType = Nodes.requireName(targetType, "cast type");
        this.operand = Nodes.requireExpression(operand, "cast operand");
    }

    public String getTargetType() {
        return targetType;
    }

    public Node getOperand() {
        return operand;
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
        return new Cast(targetType, newOperand, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Cast)) {
            return false;
        }
        Cast that = (Cast) o;
        return targetType.equals(that.targetType) && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetType, operand);
    }

    @Override
    public String toString() {
        return "Cast{(" + targetType + ") " + operand + "}";
    }
}
