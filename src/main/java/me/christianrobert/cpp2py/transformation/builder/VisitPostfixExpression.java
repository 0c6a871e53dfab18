package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.Subscript;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.List;

/**
 * Static helper for member access ({@code .} and {@code ->}), calls and subscripts.
 */
public class VisitPostfixExpression {

    public static Node memberAccess(CppParser.ExpressionContext objectCtx, String attribute, ParserRuleContext ctx,
                                    TreeConverter b) {
        Node object = b.convertExpression(objectCtx);
        String type = b.index().fieldType(object.getInferredType(), attribute);
        return new MemberAccess(object, attribute, TreeConverter.location(ctx), type);
    }

    public static Node call(CppParser.CallExprContext ctx, TreeConverter b) {
        Node callee = b.convertExpression(ctx.expression());
        List<Node> arguments = b.convertArguments(ctx.expressionList());
        return new Call(callee, arguments, List.of(), TreeConverter.location(ctx), callType(callee, arguments, b));
    }

    public static Node subscript(CppParser.SubscriptExprContext ctx, TreeConverter b) {
        Node value = b.convertExpression(ctx.expression(0));
        Node index = b.convertExpression(ctx.expression(1));
        return new Subscript(value, index, TreeConverter.location(ctx),
                TreeConverter.elementTypeOf(value.getInferredType()));
    }

    /**
     * Best-effort result type of a call.
     */
    private static String callType(Node callee, List<Node> arguments, TreeConverter b) {
        if (callee instanceof Identifier) {
            Identifier function = (Identifier) callee;
            if (b.typeMapper().isKnownClass(function.getName())) {
                return function.getName();
            }
            String declared = b.index().functionReturnType(function.getName());
            if (declared != null) {
                return declared;
            }
            switch (function.getUnqualifiedStdName()) {
                case "to_string":
                case "string":
                    return "std::string";
                case "stoi":
                case "stol":
                case "stoll":
                case "abs":
                    return "int";
                case "stod":
                case "stof":
                case "sqrt":
                case "pow":
                case "floor":
                case "ceil":
                case "sin":
                case "cos":
                case "tan":
                case "exp":
                case "log":
                case "fabs":
                    return "double";
                case "min":
                case "max":
                    return arguments.isEmpty() ? null
                            : VisitBinaryExpression.resultType(arguments.get(0).getInferredType(), "+",
                                    arguments.get(arguments.size() - 1).getInferredType());
                default:
                    return null;
            }
        }
        if (callee instanceof MemberAccess) {
            MemberAccess method = (MemberAccess) callee;
            String objectType = method.getObject().getInferredType();
            switch (method.getAttribute()) {
                case "size":
                case "length":
                    return CppTypeMapper.isContainer(objectType) || "std::string".equals(objectType) ? "int" : null;
                case "empty":
                    return "bool";
                case "substr":
                    return "std::string";
                case "at":
                case "front":
                case "back":
                    return TreeConverter.elementTypeOf(objectType);
                default:
                    return null;
            }
        }
        return null;
    }
}
