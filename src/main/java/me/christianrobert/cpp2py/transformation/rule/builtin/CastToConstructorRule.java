package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Cast;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.List;

/**
 * Rewrites casts to primitive types as Python constructor calls:
 * {@code (int) x} → {@code int(x)}, {@code static_cast<double>(n)} → {@code float(n)}.
 *
 * <p>A cast to {@code char} of an integral operand becomes {@code chr(x)}; a cast of a
 * character to {@code int} becomes {@code ord(c)}. Casts to other types are left alone
 * and render as their operand.</p>
 */
public class CastToConstructorRule implements Rule {

    public static final String NAME = "cast-to-constructor";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "(int) x and static_cast<double>(x) become int(x) and float(x)";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof Cast)) {
            return node;
        }
        Cast cast = (Cast) node;
        Node operand = cast.getOperand();
        String target = cast.getTargetType();
        String operandType = operand.getInferredType();

        String function;
        switch (target == null ? "" : target) {
            case "int":
                function = "char".equals(operandType) ? "ord" : "int";
                break;
            case "double":
                function = "float";
                break;
            case "bool":
                function = "bool";
                break;
            case "std::string":
                function = "str";
                break;
            case "char":
                if (!CppTypeMapper.isIntegral(operandType)) {
                    return node;
                }
                function = "chr";
                break;
            default:
                return node;
        }
        return new Call(new Identifier(function), List.of(operand), List.of(), cast.getLocation(), target);
    }
}
