package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.ForLoop;

/**
 * Static helper for C-style for loops.
 *
 * <p>The loop keeps its init/condition/step/body slots so that a canonical counting
 * loop can later be recognised as a range loop. Only a single declarator or a single
 * expression is supported in init and step; comma lists make the loop opaque.</p>
 */
public class VisitForStatement {

    public static Node v(CppParser.ForStatementContext ctx, TreeConverter b) {
        return b.withScope(() -> {
            Node init = init(ctx.forInit(), b);
            Node condition = ctx.forCondition != null ? b.convertExpression(ctx.forCondition) : null;
            Node step = step(ctx.forStep(), b);
            Block body = b.toBlock(ctx.statement());
            return new ForLoop(init, condition, step, body, TreeConverter.location(ctx));
        });
    }

    private static Node init(CppParser.ForInitContext ctx, TreeConverter b) {
        if (ctx == null) {
            return null;
        }
        if (ctx.forDeclaration() != null) {
            CppParser.ForDeclarationContext declaration = ctx.forDeclaration();
            if (declaration.initDeclarator().size() > 1) {
                throw b.unsupported("multi-variable for-loop initializer", ctx);
            }
            return VisitSimpleDeclaration.declarator(TreeConverter.spacedText(declaration.typeSpecifier()),
                    declaration.initDeclarator(0), b);
        }
        if (ctx.expression().size() > 1) {
            throw b.unsupported("comma expression in for-loop initializer", ctx);
        }
        return b.convertSideEffect(ctx.expression(0));
    }

    private static Node step(CppParser.ForStepContext ctx, TreeConverter b) {
        if (ctx == null) {
            return null;
        }
        if (ctx.expression().size() > 1) {
            throw b.unsupported("comma expression in for-loop step", ctx);
        }
        return b.convertSideEffect(ctx.expression(0));
    }
}
