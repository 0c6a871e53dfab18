package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Parameter;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for function, method and constructor definitions.
 *
 * <p>Constructors become functions named after their class whose bodies start with the
 * member initializers as {@code this.member = value} assignments; a base class
 * initializer becomes {@code super().__init__(...)}. Renaming to {@code __init__} and
 * adding {@code self} is left to the class rewrite rule.</p>
 */
public class VisitFunctionDefinition {

    public static Node v(CppParser.FunctionDefinitionContext ctx, boolean member, TreeConverter b) {
        CppParser.DeclaratorNameContext declaratorName = ctx.declaratorName();
        if (declaratorName.overloadableOperator() != null) {
            throw b.unsupported("operator overload", ctx);
        }
        if (declaratorName.qualifiedName().Identifier().size() > 1) {
            throw b.unsupported("out-of-class member definition", ctx);
        }

        String name = declaratorName.getText();
        String returnType = ctx.pointerOperator().isEmpty()
                ? b.typeMapper().toPython(CppTypeMapper.normalize(TreeConverter.spacedText(ctx.typeSpecifier())))
                : null;
        boolean staticMethod = member && ctx.declSpecifier().stream().anyMatch(s -> "static".equals(s.getText()));

        return b.withScope(() -> {
            List<Parameter> parameters = parameters(ctx.parameterList(), b);
            Block body = b.toBlock(ctx.compoundStatement());
            return new FunctionDef(name, parameters, returnType, body, staticMethod, TreeConverter.location(ctx));
        });
    }

    public static Node constructor(CppParser.ConstructorDefinitionContext ctx, String className, List<String> bases,
                                   TreeConverter b) {
        SourceLocation location = TreeConverter.location(ctx);
        return b.withScope(() -> {
            List<Parameter> parameters = parameters(ctx.parameterList(), b);
            List<Node> statements = new ArrayList<>();
            if (ctx.memberInitializerList() != null) {
                for (CppParser.MemberInitializerContext initializer : ctx.memberInitializerList().memberInitializer()) {
                    statements.add(memberInitializer(initializer, className, bases, b));
                }
            }
            statements.addAll(b.toBlock(ctx.compoundStatement()).getStatements());
            return new FunctionDef(className, parameters, null, new Block(statements), false, location);
        });
    }

    private static Node memberInitializer(CppParser.MemberInitializerContext ctx, String className,
                                          List<String> bases, TreeConverter b) {
        String member = ctx.Identifier().getText();
        SourceLocation location = TreeConverter.location(ctx);

        if (bases.contains(member)) {
            List<Node> arguments = b.convertArguments(ctx.expressionList());
            Node superInit = new MemberAccess(Call.of("super"), "__init__");
            return new ExpressionStatement(new Call(superInit, arguments, List.of(), location, null), location);
        }

        String fieldType = b.index().fieldType(className, member);
        Node value = ctx.bracedInitList() != null
                ? VisitSimpleDeclaration.bracedValue(fieldType, ctx.bracedInitList(), b)
                : VisitSimpleDeclaration.constructed(fieldType, b.convertArguments(ctx.expressionList()), ctx, b);
        Node target = new MemberAccess(new Identifier("this", location, className), member, location, fieldType);
        return new Assignment(target, "=", value, null, false, location);
    }

    static List<Parameter> parameters(CppParser.ParameterListContext ctx, TreeConverter b) {
        List<Parameter> parameters = new ArrayList<>();
        if (ctx == null) {
            return parameters;
        }
        if ("...".equals(ctx.getStop().getText())) {
            throw b.unsupported("variadic function", ctx);
        }

        List<CppParser.ParameterContext> declared = ctx.parameter();
        for (int i = 0; i < declared.size(); i++) {
            CppParser.ParameterContext parameter = declared.get(i);
            String type = CppTypeMapper.normalize(TreeConverter.spacedText(parameter.typeSpecifier()));
            if ("void".equals(type) && parameter.Identifier() == null && parameter.pointerOperator().isEmpty()) {
                // f(void)
                continue;
            }
            if (!parameter.arraySuffix().isEmpty()) {
                type = "std::vector<" + type + ">";
            }
            String name = parameter.Identifier() != null ? parameter.Identifier().getText() : "arg" + i;
            boolean pointer = parameter.pointerOperator().stream().anyMatch(op -> op.getText().startsWith("*"));
            Node defaultValue = parameter.initializerClause() != null
                    ? b.convertInitializerClause(parameter.initializerClause(), type)
                    : null;
            b.scope().declare(name, type);
            parameters.add(new Parameter(name, pointer ? null : b.typeMapper().toPython(type), defaultValue,
                    TreeConverter.location(parameter)));
        }
        return parameters;
    }
}
