package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.ConditionalExpression;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.Set;

/**
 * Static helper for binary and ternary operators, including result type inference.
 */
public class VisitBinaryExpression {

    private static final Set<String> COMPARISONS = Set.of("<", "<=", ">", ">=", "==", "!=", "and", "or");
    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

    public static Node v(CppParser.ExpressionContext leftCtx, String operator, CppParser.ExpressionContext rightCtx,
                         ParserRuleContext ctx, TreeConverter b) {
        Node left = b.convertExpression(leftCtx);
        Node right = b.convertExpression(rightCtx);
        return new BinaryOp(left, operator, right, TreeConverter.location(ctx),
                resultType(left.getInferredType(), operator, right.getInferredType()));
    }

    public static Node conditional(CppParser.ConditionalExprContext ctx, TreeConverter b) {
        Node condition = b.convertExpression(ctx.expression(0));
        Node whenTrue = b.convertExpression(ctx.expression(1));
        Node whenFalse = b.convertExpression(ctx.expression(2));
        String type = whenTrue.getInferredType() != null ? whenTrue.getInferredType() : whenFalse.getInferredType();
        return new ConditionalExpression(condition, whenTrue, whenFalse, TreeConverter.location(ctx), type);
    }

    /**
     * C++ usual arithmetic conversions, reduced to the normalized types.
     */
    static String resultType(String left, String operator, String right) {
        if (COMPARISONS.contains(operator)) {
            return "bool";
        }
        if (ARITHMETIC.contains(operator)) {
            if ("+".equals(operator) && (CppTypeMapper.isString(left) || CppTypeMapper.isString(right))
                    && ("std::string".equals(left) || "std::string".equals(right))) {
                return "std::string";
            }
            if (CppTypeMapper.isFloating(left) && CppTypeMapper.isNumeric(right)
                    || CppTypeMapper.isFloating(right) && CppTypeMapper.isNumeric(left)) {
                return "double";
            }
            if (isIntegralLike(left) && isIntegralLike(right)) {
                return "int";
            }
            return null;
        }
        // bitwise and shift operators
        if (isIntegralLike(left) && isIntegralLike(right)) {
            return "int";
        }
        return null;
    }

    private static boolean isIntegralLike(String type) {
        return CppTypeMapper.isIntegral(type) || "bool".equals(type);
    }
}
