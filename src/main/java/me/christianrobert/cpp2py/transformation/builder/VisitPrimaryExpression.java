package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Static helper for primary expressions: literals, names, {@code this}, parentheses
 * and the named casts.
 *
 * <p>Literals are respelled for Python: integer suffixes dropped, C octal {@code 017}
 * becomes {@code 0o17}, {@code true/false/nullptr/NULL} become {@code True/False/None},
 * adjacent string literals are concatenated and character literals become one-character
 * strings.</p>
 */
public class VisitPrimaryExpression {

    public static Node v(CppParser.PrimaryExpressionContext ctx, TreeConverter b) {
        SourceLocation location = TreeConverter.location(ctx);

        if (ctx instanceof CppParser.LiteralPrimaryContext) {
            return literal(((CppParser.LiteralPrimaryContext) ctx).literal(), location);
        }
        if (ctx instanceof CppParser.ThisPrimaryContext) {
            return new Identifier("this", location, b.currentClass());
        }
        if (ctx instanceof CppParser.TemplateConstructPrimaryContext) {
            CppParser.TemplateConstructPrimaryContext construct = (CppParser.TemplateConstructPrimaryContext) ctx;
            String type = CppTypeMapper.normalize(TreeConverter.spacedText(construct.qualifiedName())
                    + TreeConverter.spacedText(construct.templateArguments()));
            if (construct.bracedInitList() != null) {
                return VisitSimpleDeclaration.bracedValue(type, construct.bracedInitList(), b);
            }
            return VisitSimpleDeclaration.constructed(type, b.convertArguments(construct.expressionList()), ctx, b);
        }
        if (ctx instanceof CppParser.NamePrimaryContext) {
            String name = ((CppParser.NamePrimaryContext) ctx).qualifiedName().getText();
            if (name.startsWith("::")) {
                name = name.substring(2);
            }
            if ("NULL".equals(name)) {
                return new Literal(LiteralType.NONE, "None", location, null);
            }
            return new Identifier(name, location, b.scope().lookup(name));
        }
        if (ctx instanceof CppParser.ParenthesizedPrimaryContext) {
            return b.convertExpression(((CppParser.ParenthesizedPrimaryContext) ctx).expression());
        }
        if (ctx instanceof CppParser.NamedCastPrimaryContext) {
            return namedCast((CppParser.NamedCastPrimaryContext) ctx, b);
        }
        if (ctx instanceof CppParser.LambdaPrimaryContext) {
            throw b.unsupported("lambda expression", ctx);
        }
        if (ctx instanceof CppParser.NewPrimaryContext) {
            throw b.unsupported("new expression", ctx);
        }
        if (ctx instanceof CppParser.DeletePrimaryContext) {
            throw b.unsupported("delete expression", ctx);
        }
        throw b.unsupported("sizeof", ctx);
    }

    private static Node namedCast(CppParser.NamedCastPrimaryContext ctx, TreeConverter b) {
        String keyword = ctx.castKeyword().getText();
        switch (keyword) {
            case "static_cast":
                if (!ctx.pointerOperator().isEmpty()) {
                    throw b.unsupported("pointer cast", ctx);
                }
                return VisitCastExpression.v(TreeConverter.spacedText(ctx.typeSpecifier()), ctx.expression(), ctx, b);
            case "const_cast":
                return b.convertExpression(ctx.expression());
            default:
                throw b.unsupported(keyword, ctx);
        }
    }

    static Literal literal(CppParser.LiteralContext ctx, SourceLocation location) {
        if (ctx instanceof CppParser.IntegerLiteralContext) {
            String text = ((CppParser.IntegerLiteralContext) ctx).IntegerLiteral().getText();
            return new Literal(LiteralType.INTEGER, integerText(text), location, "int");
        }
        if (ctx instanceof CppParser.FloatingLiteralContext) {
            String text = ((CppParser.FloatingLiteralContext) ctx).FloatingLiteral().getText();
            return new Literal(LiteralType.FLOAT, floatingText(text), location, "double");
        }
        if (ctx instanceof CppParser.StringLiteralContext) {
            StringBuilder body = new StringBuilder();
            for (TerminalNode part : ((CppParser.StringLiteralContext) ctx).StringLiteral()) {
                String text = stripEncodingPrefix(part.getText());
                body.append(text, 1, text.length() - 1);
            }
            return new Literal(LiteralType.STRING, body.toString(), location, "std::string");
        }
        if (ctx instanceof CppParser.CharacterLiteralContext) {
            String text = stripEncodingPrefix(((CppParser.CharacterLiteralContext) ctx).CharacterLiteral().getText());
            String body = text.substring(1, text.length() - 1);
            body = body.replace("\\'", "'");
            if (body.equals("\"")) {
                body = "\\\"";
            }
            return new Literal(LiteralType.STRING, body, location, "char");
        }
        if (ctx instanceof CppParser.BooleanLiteralContext) {
            boolean value = "true".equals(ctx.getText());
            return new Literal(LiteralType.BOOLEAN, value ? "True" : "False", location, "bool");
        }
        return new Literal(LiteralType.NONE, "None", location, null);
    }

    /**
     * Drops {@code u/l} suffixes and rewrites C octal for Python.
     */
    static String integerText(String text) {
        String digits = text.replaceAll("[uUlL]+$", "");
        if (digits.length() > 1 && digits.startsWith("0") && digits.chars().allMatch(Character::isDigit)) {
            return "0o" + digits.substring(1);
        }
        return digits;
    }

    static String floatingText(String text) {
        String digits = text.replaceAll("[fFlL]$", "");
        if (digits.startsWith(".")) {
            digits = "0" + digits;
        }
        return digits;
    }

    private static String stripEncodingPrefix(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) != '"' && text.charAt(i) != '\'') {
            i++;
        }
        return text.substring(i);
    }
}
