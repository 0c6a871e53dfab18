package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.ListLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import org.antlr.v4.runtime.ParserRuleContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for variable declarations.
 *
 * <p>Each declarator becomes one annotated assignment ({@code x: int = 5}). Values for
 * the different initializer forms:</p>
 * <pre>
 * int x;                     x: int = None
 * std::string s;             s: str = ""
 * std::vector&lt;int&gt; v;        v: list[int] = []
 * std::vector&lt;int&gt; v(n, 1);  v: list[int] = [1] * n
 * int a[5];                  a: list[int] = [0] * 5
 * int a[5] = {1, 2};         a: list[int] = [1, 2] + [0] * 3
 * Point p(1, 2);             p: Point = Point(1, 2)
 * </pre>
 */
public class VisitSimpleDeclaration {

    public static List<Node> v(CppParser.SimpleDeclarationContext ctx, TreeConverter b) {
        for (CppParser.DeclSpecifierContext specifier : ctx.declSpecifier()) {
            if ("extern".equals(specifier.getText())) {
                // defined in another translation unit
                return List.of();
            }
        }
        return declarators(TreeConverter.spacedText(ctx.typeSpecifier()), ctx.initDeclarator(), b);
    }

    static List<Node> declarators(String typeText, List<CppParser.InitDeclaratorContext> declarators, TreeConverter b) {
        List<Node> result = new ArrayList<>();
        for (CppParser.InitDeclaratorContext declarator : declarators) {
            result.add(declarator(typeText, declarator, b));
        }
        return result;
    }

    static Assignment declarator(String typeText, CppParser.InitDeclaratorContext ctx, TreeConverter b) {
        String name = ctx.Identifier().getText();
        SourceLocation location = TreeConverter.location(ctx);
        String baseType = CppTypeMapper.normalize(typeText);
        boolean pointer = ctx.pointerOperator().stream().anyMatch(op -> op.getText().startsWith("*"));

        String type;
        Node value;
        if (ctx.arraySuffix().size() > 1) {
            throw b.unsupported("multi-dimensional array", ctx);
        } else if (ctx.arraySuffix().size() == 1) {
            if ("char".equals(baseType) && ctx.initializer() instanceof CppParser.CopyInitializerContext
                    && ((CppParser.CopyInitializerContext) ctx.initializer()).initializerClause().expression() != null) {
                type = "std::string";
                value = b.convertExpression(((CppParser.CopyInitializerContext) ctx.initializer()).initializerClause().expression());
            } else {
                type = "std::vector<" + baseType + ">";
                value = arrayValue(baseType, ctx.arraySuffix(0), ctx.initializer(), ctx, b);
            }
        } else {
            type = baseType;
            value = initialValue(type, ctx.initializer(), ctx, b);
            if ("auto".equals(type)) {
                type = value.getInferredType();
            }
        }

        String typeHint = pointer ? null : b.typeMapper().toPython(type);
        b.scope().declare(name, type);
        return new Assignment(new Identifier(name, location, type), "=", value, typeHint, true, location);
    }

    private static Node initialValue(String type, CppParser.InitializerContext initializer, ParserRuleContext ctx,
                                     TreeConverter b) {
        if (initializer == null) {
            return b.typeMapper().defaultValue(type);
        }
        if (initializer instanceof CppParser.CopyInitializerContext) {
            CppParser.InitializerClauseContext clause = ((CppParser.CopyInitializerContext) initializer).initializerClause();
            if (clause.bracedInitList() != null) {
                return bracedValue(type, clause.bracedInitList(), b);
            }
            return b.convertExpression(clause.expression());
        }
        if (initializer instanceof CppParser.ConstructorInitializerContext) {
            CppParser.ExpressionListContext arguments = ((CppParser.ConstructorInitializerContext) initializer).expressionList();
            return constructed(type, b.convertArguments(arguments), ctx, b);
        }
        return bracedValue(type, ((CppParser.BraceInitializerContext) initializer).bracedInitList(), b);
    }

    /**
     * Value of {@code T{...}} / {@code T x = {...}}: a list for sequences, a set call for
     * sets, a constructor call for user classes, the single element for scalars.
     */
    static Node bracedValue(String type, CppParser.BracedInitListContext ctx, TreeConverter b) {
        String base = CppTypeMapper.templateName(type);
        if (CppTypeMapper.isContainer(type) && base.endsWith("set")) {
            Node elements = b.convertBracedList(ctx, "std::vector<" + TreeConverter.elementTypeOf(type) + ">");
            return new Call(new Identifier("set"), List.of(elements), List.of(), TreeConverter.location(ctx), type);
        }
        if (CppTypeMapper.isContainer(type)) {
            return b.convertBracedList(ctx, type);
        }
        List<Node> elements = new ArrayList<>();
        for (CppParser.InitializerClauseContext clause : ctx.initializerClause()) {
            elements.add(b.convertInitializerClause(clause, null));
        }
        if (b.typeMapper().isKnownClass(type)) {
            return new Call(new Identifier(type), elements, List.of(), TreeConverter.location(ctx), type);
        }
        if (elements.isEmpty()) {
            return b.typeMapper().elementDefault(type);
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        throw b.unsupported("braced initializer for " + type, ctx);
    }

    /**
     * Value of {@code T(args)} / {@code T x(args)}.
     */
    static Node constructed(String type, List<Node> arguments, ParserRuleContext ctx, TreeConverter b) {
        SourceLocation location = TreeConverter.location(ctx);
        if (arguments.isEmpty()) {
            return b.typeMapper().defaultValue(type);
        }
        if (type == null && arguments.size() == 1) {
            return arguments.get(0);
        }
        if (b.typeMapper().isKnownClass(type)) {
            return new Call(new Identifier(type), arguments, List.of(), location, type);
        }
        String base = CppTypeMapper.templateName(type);
        if (CppTypeMapper.isContainer(type) && !base.endsWith("map") && !base.endsWith("set") && arguments.size() <= 2) {
            Node element = arguments.size() == 2
                    ? arguments.get(1)
                    : b.typeMapper().elementDefault(TreeConverter.elementTypeOf(type));
            return new BinaryOp(new ListLiteral(List.of(element)), "*", arguments.get(0), location, type);
        }
        if ("std::string".equals(type)) {
            if (arguments.size() == 1) {
                return arguments.get(0);
            }
            if (arguments.size() == 2) {
                return new BinaryOp(arguments.get(1), "*", arguments.get(0), location, type);
            }
        }
        if ((CppTypeMapper.isNumeric(type) || "bool".equals(type) || "char".equals(type)) && arguments.size() == 1) {
            return arguments.get(0);
        }
        throw b.unsupported("constructor arguments for " + type, ctx);
    }

    private static Node arrayValue(String elementType, CppParser.ArraySuffixContext suffix,
                                   CppParser.InitializerContext initializer, ParserRuleContext ctx, TreeConverter b) {
        String listType = "std::vector<" + elementType + ">";
        Node size = suffix.expression() != null ? b.convertExpression(suffix.expression()) : null;

        CppParser.BracedInitListContext braced = null;
        if (initializer instanceof CppParser.BraceInitializerContext) {
            braced = ((CppParser.BraceInitializerContext) initializer).bracedInitList();
        } else if (initializer instanceof CppParser.CopyInitializerContext) {
            braced = ((CppParser.CopyInitializerContext) initializer).initializerClause().bracedInitList();
        }
        if (initializer != null && braced == null) {
            throw b.unsupported("array initializer", ctx);
        }

        if (braced == null) {
            if (size == null) {
                throw b.unsupported("array without size or initializer", ctx);
            }
            return filled(elementType, size, b);
        }

        ListLiteral elements = (ListLiteral) b.convertBracedList(braced, listType);
        Long declaredSize = size instanceof Literal ? ((Literal) size).asDecimalInteger() : null;
        int given = elements.getElements().size();
        if (declaredSize == null || declaredSize <= given) {
            return elements;
        }
        // remaining elements are value-initialized
        Node rest = filled(elementType, Literal.integer(declaredSize - given), b);
        if (given == 0) {
            return rest;
        }
        return new BinaryOp(elements, "+", rest, TreeConverter.location(ctx), listType);
    }

    private static Node filled(String elementType, Node size, TreeConverter b) {
        Node element = b.typeMapper().elementDefault(elementType);
        return new BinaryOp(new ListLiteral(List.of(element)), "*", size, null, "std::vector<" + elementType + ">");
    }
}
