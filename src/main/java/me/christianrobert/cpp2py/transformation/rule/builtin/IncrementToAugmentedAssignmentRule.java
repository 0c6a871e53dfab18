package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;

/**
 * Rewrites standalone {@code x++} / {@code --x} statements to {@code x += 1} / {@code x -= 1}.
 * Increments nested inside larger expressions are left to the generator.
 */
public class IncrementToAugmentedAssignmentRule implements Rule {

    public static final String NAME = "increment-to-augmented-assignment";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "i++ as a statement becomes i += 1";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ExpressionStatement) || !(((ExpressionStatement) node).getExpression() instanceof UnaryOp)) {
            return node;
        }
        UnaryOp unary = (UnaryOp) ((ExpressionStatement) node).getExpression();
        if (!unary.isIncrementOrDecrement()) {
            return node;
        }
        String operator = "++".equals(unary.getOperator()) ? "+=" : "-=";
        return new Assignment(unary.getOperand(), operator, Literal.integer(1), null, false, node.getLocation());
    }
}
