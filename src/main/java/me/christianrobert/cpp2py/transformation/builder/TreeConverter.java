package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.antlr.CppBaseVisitor;
import me.christianrobert.cpp2py.antlr.CppParser;
import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.ListLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.Break;
import me.christianrobert.cpp2py.transformation.tree.statement.Continue;
import me.christianrobert.cpp2py.transformation.tree.statement.DoWhileLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.If;
import me.christianrobert.cpp2py.transformation.tree.statement.Opaque;
import me.christianrobert.cpp2py.transformation.tree.statement.Return;
import me.christianrobert.cpp2py.transformation.tree.statement.WhileLoop;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;
import me.christianrobert.cpp2py.transformation.type.TypeScope;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lowers the ANTLR C++ parse tree into the internal tree.
 *
 * <p>Expressions are converted by the visitor methods (one per labeled alternative);
 * statements and declarations by {@link #convertStatement} and {@link #convertDeclaration},
 * which may produce several nodes (e.g. {@code int a = 1, b = 2;}) or none
 * ({@code using namespace std;}). Larger constructs delegate to the static
 * {@code Visit*} helpers of this package.</p>
 *
 * <p>Fail-soft: a construct outside the supported subset raises
 * {@link UnsupportedConstructException}; the nearest enclosing statement or declaration
 * catches it, discards whatever it had converted so far (including diagnostics), and
 * becomes one {@link Opaque} node carrying its verbatim source span.</p>
 *
 * <p>A converter instance is single-use and not thread-safe.</p>
 */
public class TreeConverter extends CppBaseVisitor<Node> {

    private final DeclarationIndex index;
    private final CppTypeMapper typeMapper;
    private final TypeScope scope = new TypeScope();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Deque<String> classStack = new ArrayDeque<>();

    private TreeConverter(DeclarationIndex index) {
        this.index = index;
        this.typeMapper = new CppTypeMapper(index.getClassNames());
    }

    /**
     * Converts a parsed translation unit.
     *
     * @param tree Root of a parse tree without syntax errors
     * @return the module and its conversion diagnostics
     */
    public static ConversionResult convert(CppParser.TranslationUnitContext tree) {
        TreeConverter converter = new TreeConverter(DeclarationIndex.build(tree));
        List<Node> body = new ArrayList<>();
        for (CppParser.DeclarationContext declaration : tree.declaration()) {
            body.addAll(converter.convertDeclaration(declaration));
        }
        return new ConversionResult(new Module(body), converter.diagnostics);
    }

    // ========== ACCESSORS FOR VISIT HELPERS ==========

    CppTypeMapper typeMapper() {
        return typeMapper;
    }

    TypeScope scope() {
        return scope;
    }

    DeclarationIndex index() {
        return index;
    }

    /**
     * Name of the class whose members are being converted, or null at namespace scope.
     */
    String currentClass() {
        return classStack.peek();
    }

    void enterClass(String className) {
        classStack.push(className);
    }

    void exitClass() {
        classStack.pop();
    }

    // ========== DECLARATIONS ==========

    /**
     * Converts one namespace-scope declaration.
     */
    List<Node> convertDeclaration(CppParser.DeclarationContext ctx) {
        return failSoft(ctx, () -> {
            if (ctx.usingDirective() != null || ctx.forwardDeclaration() != null
                    || ctx.functionPrototype() != null || ctx.emptyDeclaration() != null) {
                return List.of();
            }
            if (ctx.aliasDeclaration() != null) {
                throw unsupported("type alias", ctx);
            }
            if (ctx.templateDeclaration() != null) {
                throw unsupported("template", ctx);
            }
            if (ctx.namespaceDefinition() != null) {
                throw unsupported("namespace", ctx);
            }
            if (ctx.typedefDeclaration() != null) {
                throw unsupported("typedef", ctx);
            }
            if (ctx.enumDefinition() != null) {
                throw unsupported("enum", ctx);
            }
            if (ctx.outOfClassSpecialMember() != null) {
                throw unsupported("out-of-class constructor or destructor definition", ctx);
            }
            if (ctx.classDefinition() != null) {
                return List.of(VisitClassDefinition.v(ctx.classDefinition(), this));
            }
            if (ctx.functionDefinition() != null) {
                return List.of(VisitFunctionDefinition.v(ctx.functionDefinition(), false, this));
            }
            return VisitSimpleDeclaration.v(ctx.simpleDeclaration(), this);
        });
    }

    // ========== STATEMENTS ==========

    /**
     * Converts one statement. Compound statements are flattened into the enclosing
     * suite, since Python has no block scope.
     */
    List<Node> convertStatement(CppParser.StatementContext ctx) {
        return failSoft(ctx, () -> convertStatementUnchecked(ctx));
    }

    private List<Node> convertStatementUnchecked(CppParser.StatementContext ctx) {
        if (ctx.compoundStatement() != null) {
            return withScope(() -> convertStatements(ctx.compoundStatement().statement()));
        }
        if (ctx.declarationStatement() != null) {
            return VisitSimpleDeclaration.v(ctx.declarationStatement().simpleDeclaration(), this);
        }
        if (ctx.ifStatement() != null) {
            CppParser.IfStatementContext ifCtx = ctx.ifStatement();
            Node condition = convertExpression(ifCtx.expression());
            Block thenBlock = toBlock(ifCtx.thenBranch);
            Block elseBlock = ifCtx.elseBranch != null ? toBlock(ifCtx.elseBranch) : null;
            return List.of(new If(condition, thenBlock, elseBlock, location(ctx)));
        }
        if (ctx.whileStatement() != null) {
            CppParser.WhileStatementContext whileCtx = ctx.whileStatement();
            Node condition = convertExpression(whileCtx.expression());
            return List.of(new WhileLoop(condition, toBlock(whileCtx.statement()), location(ctx)));
        }
        if (ctx.doWhileStatement() != null) {
            CppParser.DoWhileStatementContext doCtx = ctx.doWhileStatement();
            Block body = toBlock(doCtx.statement());
            return List.of(new DoWhileLoop(body, convertExpression(doCtx.expression()), location(ctx)));
        }
        if (ctx.forStatement() != null) {
            return List.of(VisitForStatement.v(ctx.forStatement(), this));
        }
        if (ctx.rangeForStatement() != null) {
            return List.of(convertRangeFor(ctx.rangeForStatement()));
        }
        if (ctx.switchStatement() != null) {
            throw unsupported("switch statement", ctx);
        }
        if (ctx.tryBlock() != null) {
            throw unsupported("try/catch", ctx);
        }
        if (ctx.throwStatement() != null) {
            throw unsupported("throw", ctx);
        }
        if (ctx.gotoStatement() != null || ctx.labeledStatement() != null) {
            throw unsupported("goto or label", ctx);
        }
        if (ctx.returnStatement() != null) {
            CppParser.ReturnStatementContext returnCtx = ctx.returnStatement();
            Node value = null;
            if (returnCtx.expression() != null) {
                value = convertExpression(returnCtx.expression());
            } else if (returnCtx.bracedInitList() != null) {
                value = convertBracedList(returnCtx.bracedInitList(), null);
            }
            return List.of(new Return(value, location(ctx)));
        }
        if (ctx.breakStatement() != null) {
            return List.of(new Break(location(ctx)));
        }
        if (ctx.continueStatement() != null) {
            return List.of(new Continue(location(ctx)));
        }
        if (ctx.expressionStatement() != null) {
            return List.of(convertSideEffect(ctx.expressionStatement().expression()));
        }
        // using directive or empty statement
        return List.of();
    }

    List<Node> convertStatements(List<CppParser.StatementContext> statements) {
        List<Node> result = new ArrayList<>();
        for (CppParser.StatementContext statement : statements) {
            result.addAll(convertStatement(statement));
        }
        return result;
    }

    /**
     * Converts a statement used as a loop or branch body into its own scoped block.
     */
    Block toBlock(CppParser.StatementContext ctx) {
        return new Block(withScope(() -> convertStatement(ctx)));
    }

    Block toBlock(CppParser.CompoundStatementContext ctx) {
        return new Block(withScope(() -> convertStatements(ctx.statement())));
    }

    private Node convertRangeFor(CppParser.RangeForStatementContext ctx) {
        Node iterable = ctx.expression() != null
                ? convertExpression(ctx.expression())
                : convertBracedList(ctx.bracedInitList(), null);
        String declared = CppTypeMapper.normalize(spacedText(ctx.typeSpecifier()));
        String elementType = "auto".equals(declared) ? elementTypeOf(iterable.getInferredType()) : declared;
        String target = ctx.Identifier().getText();
        return withScope(() -> {
            scope.declare(target, elementType);
            return new ForEach(target, iterable, toBlock(ctx.statement()), location(ctx));
        });
    }

    /**
     * Converts an expression evaluated for its side effect into a statement: an
     * assignment, an increment statement, or an expression statement.
     */
    Node convertSideEffect(CppParser.ExpressionContext ctx) {
        if (ctx instanceof CppParser.AssignmentExprContext) {
            CppParser.AssignmentExprContext assignment = (CppParser.AssignmentExprContext) ctx;
            return VisitAssignmentExpression.v(assignment.expression(0), assignment.assignmentOperator().getText(),
                    convertExpression(assignment.expression(1)), ctx, this);
        }
        if (ctx instanceof CppParser.BraceAssignmentExprContext) {
            CppParser.BraceAssignmentExprContext assignment = (CppParser.BraceAssignmentExprContext) ctx;
            Node target = convertExpression(assignment.expression());
            return VisitAssignmentExpression.v(assignment.expression(), assignment.assignmentOperator().getText(),
                    convertBracedList(assignment.bracedInitList(), target.getInferredType()), ctx, this);
        }
        if (ctx instanceof CppParser.PostfixExprContext) {
            CppParser.PostfixExprContext postfix = (CppParser.PostfixExprContext) ctx;
            return new ExpressionStatement(
                    statementIncrement(postfix.op.getText(), postfix.expression(), true, ctx), location(ctx));
        }
        if (isPrefixIncrement(ctx)) {
            CppParser.PrefixExprContext prefix = (CppParser.PrefixExprContext) ctx;
            return new ExpressionStatement(
                    statementIncrement(prefix.op.getText(), prefix.expression(), false, ctx), location(ctx));
        }
        if (ctx instanceof CppParser.PrimaryExprContext
                && ((CppParser.PrimaryExprContext) ctx).primaryExpression() instanceof CppParser.ParenthesizedPrimaryContext) {
            CppParser.ParenthesizedPrimaryContext parenthesized =
                    (CppParser.ParenthesizedPrimaryContext) ((CppParser.PrimaryExprContext) ctx).primaryExpression();
            return convertSideEffect(parenthesized.expression());
        }
        return new ExpressionStatement(convertExpression(ctx), location(ctx));
    }

    // a standalone increment may target any assignable expression, not only a variable
    private Node statementIncrement(String op, CppParser.ExpressionContext operandCtx, boolean postfix,
                                    ParserRuleContext ctx) {
        Node operand = convertExpression(operandCtx);
        switch (operand.getKind()) {
            case IDENTIFIER:
            case MEMBER_ACCESS:
            case SUBSCRIPT:
                return new UnaryOp(op, operand, postfix, location(ctx), operand.getInferredType());
            default:
                throw unsupported("increment or decrement of a non-assignable expression", ctx);
        }
    }

    private static boolean isPrefixIncrement(CppParser.ExpressionContext ctx) {
        if (!(ctx instanceof CppParser.PrefixExprContext)) {
            return false;
        }
        String op = ((CppParser.PrefixExprContext) ctx).op.getText();
        return "++".equals(op) || "--".equals(op);
    }

    // ========== EXPRESSIONS ==========

    Node convertExpression(CppParser.ExpressionContext ctx) {
        return visit(ctx);
    }

    /**
     * Converts an initializer clause (expression or braced list) used as a value of the
     * given normalized type.
     */
    Node convertInitializerClause(CppParser.InitializerClauseContext ctx, String expectedType) {
        if (ctx.bracedInitList() != null) {
            return convertBracedList(ctx.bracedInitList(), expectedType);
        }
        return convertExpression(ctx.expression());
    }

    /**
     * Converts {@code {a, b, c}} to a list literal. Nested lists take the element type of
     * {@code expectedType}.
     */
    Node convertBracedList(CppParser.BracedInitListContext ctx, String expectedType) {
        String base = CppTypeMapper.templateName(expectedType);
        if (base != null && (base.endsWith("map") || base.equals("std::pair") || base.equals("std::tuple"))) {
            throw unsupported("braced initializer for " + base, ctx);
        }
        String elementType = elementTypeOf(expectedType);
        List<Node> elements = new ArrayList<>();
        for (CppParser.InitializerClauseContext clause : ctx.initializerClause()) {
            elements.add(convertInitializerClause(clause, elementType));
        }
        return new ListLiteral(elements, location(ctx), expectedType);
    }

    List<Node> convertArguments(CppParser.ExpressionListContext ctx) {
        List<Node> arguments = new ArrayList<>();
        if (ctx != null) {
            for (CppParser.InitializerClauseContext clause : ctx.initializerClause()) {
                arguments.add(convertInitializerClause(clause, null));
            }
        }
        return arguments;
    }

    @Override
    public Node visitPrimaryExpr(CppParser.PrimaryExprContext ctx) {
        return VisitPrimaryExpression.v(ctx.primaryExpression(), this);
    }

    @Override
    public Node visitMemberAccessExpr(CppParser.MemberAccessExprContext ctx) {
        return VisitPostfixExpression.memberAccess(ctx.expression(), ctx.Identifier().getText(), ctx, this);
    }

    @Override
    public Node visitArrowAccessExpr(CppParser.ArrowAccessExprContext ctx) {
        return VisitPostfixExpression.memberAccess(ctx.expression(), ctx.Identifier().getText(), ctx, this);
    }

    @Override
    public Node visitCallExpr(CppParser.CallExprContext ctx) {
        return VisitPostfixExpression.call(ctx, this);
    }

    @Override
    public Node visitSubscriptExpr(CppParser.SubscriptExprContext ctx) {
        return VisitPostfixExpression.subscript(ctx, this);
    }

    @Override
    public Node visitPostfixExpr(CppParser.PostfixExprContext ctx) {
        return increment(ctx.op.getText(), ctx.expression(), true, ctx);
    }

    @Override
    public Node visitPrefixExpr(CppParser.PrefixExprContext ctx) {
        String op = ctx.op.getText();
        switch (op) {
            case "++":
            case "--":
                return increment(op, ctx.expression(), false, ctx);
            case "*":
                throw unsupported("pointer dereference", ctx);
            case "&":
                throw unsupported("address-of operator", ctx);
            case "!":
                return new UnaryOp("not", convertExpression(ctx.expression()), false, location(ctx), "bool");
            default:
                Node operand = convertExpression(ctx.expression());
                return new UnaryOp(op, operand, false, location(ctx), operand.getInferredType());
        }
    }

    private Node increment(String op, CppParser.ExpressionContext operandCtx, boolean postfix, ParserRuleContext ctx) {
        Node operand = convertExpression(operandCtx);
        if (!(operand instanceof Identifier)) {
            throw unsupported("increment or decrement of a non-variable", ctx);
        }
        return new UnaryOp(op, operand, postfix, location(ctx), operand.getInferredType());
    }

    @Override
    public Node visitCStyleCastExpr(CppParser.CStyleCastExprContext ctx) {
        if (!ctx.castType().pointerOperator().isEmpty()) {
            throw unsupported("pointer cast", ctx);
        }
        return VisitCastExpression.v(spacedText(ctx.castType()), ctx.expression(), ctx, this);
    }

    @Override
    public Node visitMultiplicativeExpr(CppParser.MultiplicativeExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), ctx.op.getText(), ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitAdditiveExpr(CppParser.AdditiveExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), ctx.op.getText(), ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitShiftExpr(CppParser.ShiftExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), ctx.shiftOperator().getText(), ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitRelationalExpr(CppParser.RelationalExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), ctx.op.getText(), ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitEqualityExpr(CppParser.EqualityExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), ctx.op.getText(), ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitBitAndExpr(CppParser.BitAndExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), "&", ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitBitXorExpr(CppParser.BitXorExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), "^", ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitBitOrExpr(CppParser.BitOrExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), "|", ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitLogicalAndExpr(CppParser.LogicalAndExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), "and", ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitLogicalOrExpr(CppParser.LogicalOrExprContext ctx) {
        return VisitBinaryExpression.v(ctx.expression(0), "or", ctx.expression(1), ctx, this);
    }

    @Override
    public Node visitConditionalExpr(CppParser.ConditionalExprContext ctx) {
        return VisitBinaryExpression.conditional(ctx, this);
    }

    @Override
    public Node visitAssignmentExpr(CppParser.AssignmentExprContext ctx) {
        throw unsupported("assignment inside an expression", ctx);
    }

    @Override
    public Node visitBraceAssignmentExpr(CppParser.BraceAssignmentExprContext ctx) {
        throw unsupported("assignment inside an expression", ctx);
    }

    // ========== TYPE HELPERS ==========

    /**
     * Element type of a normalized container type: sequences and sets yield their first
     * template argument, maps their value type, strings {@code char}.
     */
    static String elementTypeOf(String containerType) {
        if (containerType == null) {
            return null;
        }
        if ("std::string".equals(containerType)) {
            return "char";
        }
        List<String> arguments = CppTypeMapper.templateArguments(containerType);
        if (arguments.isEmpty()) {
            return null;
        }
        String base = CppTypeMapper.templateName(containerType);
        if (base.endsWith("map")) {
            return arguments.size() > 1 ? arguments.get(1) : null;
        }
        return arguments.get(0);
    }

    // ========== FAIL-SOFT ==========

    /**
     * Runs a statement-level conversion; on an unsupported construct anywhere inside,
     * rolls back its diagnostics and returns a single opaque node instead. Scopes and the
     * class stack unwind through their own finally blocks.
     */
    List<Node> failSoft(ParserRuleContext ctx, Supplier<List<Node>> conversion) {
        int mark = diagnostics.size();
        try {
            return conversion.get();
        } catch (UnsupportedConstructException e) {
            diagnostics.subList(mark, diagnostics.size()).clear();
            return List.of(opaque(ctx, e.getMessage(), e.getLocation()));
        }
    }

    /**
     * Opaque node for {@code ctx} plus its diagnostic.
     */
    Opaque opaque(ParserRuleContext ctx, String reason, SourceLocation constructLocation) {
        SourceLocation where = constructLocation != null ? constructLocation : location(ctx);
        diagnostics.add(Diagnostic.unsupported(reason, where));
        return new Opaque(originalText(ctx), reason, where);
    }

    UnsupportedConstructException unsupported(String reason, ParserRuleContext ctx) {
        return new UnsupportedConstructException(reason, location(ctx));
    }

    <T> T withScope(Supplier<T> body) {
        scope.push();
        try {
            return body.get();
        } finally {
            scope.pop();
        }
    }

    // ========== SOURCE TEXT ==========

    static SourceLocation location(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new SourceLocation(start.getLine(), start.getCharPositionInLine() + 1);
    }

    /**
     * The exact source span of {@code ctx}, comments and whitespace included.
     */
    static String originalText(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        CharStream input = start.getInputStream();
        int stopIndex = stop != null && stop.getStopIndex() >= start.getStartIndex()
                ? stop.getStopIndex()
                : start.getStopIndex();
        return input.getText(Interval.of(start.getStartIndex(), stopIndex));
    }

    /**
     * Token text of {@code ctx} with a single space only between adjacent word tokens,
     * e.g. {@code const std::vector<unsigned int>&}.
     */
    static String spacedText(ParseTree ctx) {
        StringBuilder sb = new StringBuilder();
        appendTokens(ctx, sb);
        return sb.toString();
    }

    private static void appendTokens(ParseTree node, StringBuilder sb) {
        if (node instanceof TerminalNode) {
            String text = node.getText();
            if (sb.length() > 0 && isWordChar(sb.charAt(sb.length() - 1)) && !text.isEmpty()
                    && isWordChar(text.charAt(0))) {
                sb.append(' ');
            }
            sb.append(text);
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            appendTokens(node.getChild(i), sb);
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
