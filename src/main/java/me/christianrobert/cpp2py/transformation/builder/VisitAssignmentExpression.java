package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Static helper for assignment expressions used as statements.
 *
 * <p>Integer compound division {@code a /= b} is expanded to {@code a = a / b} so that
 * the division keeps its operand types and can be rewritten like any other division.</p>
 */
public class VisitAssignmentExpression {

    public static Node v(CppParser.ExpressionContext targetCtx, String operator, Node value, ParserRuleContext ctx,
                         TreeConverter b) {
        Node target = b.convertExpression(targetCtx);
        if (target.getKind() != NodeKind.IDENTIFIER && target.getKind() != NodeKind.MEMBER_ACCESS
                && target.getKind() != NodeKind.SUBSCRIPT) {
            throw b.unsupported("assignment to " + targetCtx.getText(), ctx);
        }

        if ("/=".equals(operator)
                && CppTypeMapper.isIntegral(target.getInferredType())
                && CppTypeMapper.isIntegral(value.getInferredType())) {
            // a second conversion keeps every node owned by exactly one parent
            Node dividend = b.convertExpression(targetCtx);
            Node division = new BinaryOp(dividend, "/", value, TreeConverter.location(ctx), "int");
            return new Assignment(target, "=", division, null, false, TreeConverter.location(ctx));
        }
        return new Assignment(target, operator, value, null, false, TreeConverter.location(ctx));
    }
}
