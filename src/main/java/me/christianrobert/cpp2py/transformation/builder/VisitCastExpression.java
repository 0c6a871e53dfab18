package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Cast;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Static helper for C-style and {@code static_cast} casts. The cast is kept as a
 * {@link Cast} node; turning it into a Python constructor call is a rewrite rule's job.
 */
public class VisitCastExpression {

    public static Node v(String typeText, CppParser.ExpressionContext operandCtx, ParserRuleContext ctx,
                         TreeConverter b) {
        String targetType = CppTypeMapper.normalize(typeText);
        if (targetType == null || "void".equals(targetType)) {
            throw b.unsupported("cast to " + typeText, ctx);
        }
        Node operand = b.convertExpression(operandCtx);
        return new Cast(targetType, operand, TreeConverter.location(ctx));
    }
}
