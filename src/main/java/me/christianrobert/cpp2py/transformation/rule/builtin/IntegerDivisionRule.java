package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.List;

/**
 * Rewrites division of two integral operands to {@code int(a / b)}.
 *
 * <p>C++ integer division truncates toward zero; Python's {@code //} floors, which differs
 * for negative operands, so the true quotient is truncated with {@code int()} instead.
 * The inner quotient is typed {@code double}, which keeps the rule from matching its own
 * output.</p>
 */
public class IntegerDivisionRule implements Rule {

    public static final String NAME = "integer-division";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "a / b on integers becomes int(a / b)";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof BinaryOp)) {
            return node;
        }
        BinaryOp division = (BinaryOp) node;
        if (!"/".equals(division.getOperator())
                || !CppTypeMapper.isIntegral(division.getInferredType())
                || !CppTypeMapper.isIntegral(division.getLeft().getInferredType())
                || !CppTypeMapper.isIntegral(division.getRight().getInferredType())) {
            return node;
        }
        BinaryOp quotient = new BinaryOp(division.getLeft(), "/", division.getRight(), division.getLocation(), "double");
        return new Call(new Identifier("int"), List.of(quotient), List.of(), division.getLocation(), "int");
    }
}
