package me.christianrobert.cpp2py.transformation.codegen;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Cast;
import me.christianrobert.cpp2py.transformation.tree.expression.ConditionalExpression;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.KeywordArgument;
import me.christianrobert.cpp2py.transformation.tree.expression.ListLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.Subscript;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for expression rendering, mostly parenthesization.
 */
class ExpressionRendererTest {

    private static final Identifier A = new Identifier("a");
    private static final Identifier B = new Identifier("b");
    private static final Identifier C = new Identifier("c");

    private static Node op(Node left, String operator, Node right) {
        return new BinaryOp(left, operator, right);
    }

    // ========== PRECEDENCE ==========

    @Test
    void looserLeftOperandIsParenthesized() {
        assertEquals("(a + b) * c", ExpressionRenderer.render(op(op(A, "+", B), "*", C)));
    }

    @Test
    void tighterOperandIsNotParenthesized() {
        assertEquals("a + b * c", ExpressionRenderer.render(op(A, "+", op(B, "*", C))));
    }

    @Test
    void rightOperandOfSamePrecedenceIsParenthesized() {
        assertEquals("a - (b - c)", ExpressionRenderer.render(op(A, "-", op(B, "-", C))));
        assertEquals("a - b - c", ExpressionRenderer.render(op(op(A, "-", B), "-", C)));
    }

    @Test
    void nestedComparisonIsParenthesizedToAvoidChaining() {
        assertEquals("(a < b) == c", ExpressionRenderer.render(op(op(A, "<", B), "==", C)));
    }

    @Test
    void booleanOperators() {
        assertEquals("a or b and c", ExpressionRenderer.render(op(A, "or", op(B, "and", C))));
        assertEquals("(a or b) and c", ExpressionRenderer.render(op(op(A, "or", B), "and", C)));
        assertEquals("not (a and b)",
                ExpressionRenderer.render(new UnaryOp("not", op(A, "and", B), false, null, "bool")));
        assertEquals("not a < b",
                ExpressionRenderer.render(new UnaryOp("not", op(A, "<", B), false, null, "bool")));
    }

    @Test
    void unaryMinusBindsTighterThanAddition() {
        assertEquals("-(a + b)", ExpressionRenderer.render(new UnaryOp("-", op(A, "+", B), false, null, null)));
        assertEquals("-a * b", ExpressionRenderer.render(op(new UnaryOp("-", A, false, null, null), "*", B)));
    }

    @Test
    void attributeOfCompoundExpressionIsParenthesized() {
        assertEquals("(a + b).real", ExpressionRenderer.render(new MemberAccess(op(A, "+", B), "real")));
    }

    // ========== INCREMENTS ==========

    @Test
    void prefixIncrementUsesWalrus() {
        Node call = Call.of("print", new UnaryOp("++", new Identifier("x"), false, null, "int"));

        assertEquals("print((x := x + 1))", ExpressionRenderer.render(call));
    }

    @Test
    void postfixIncrementYieldsOldValue() {
        Node increment = new UnaryOp("++", new Identifier("x"), true, null, "int");
        Node decrement = new UnaryOp("--", new Identifier("x"), true, null, "int");

        assertEquals("((x := x + 1) - 1)", ExpressionRenderer.render(increment));
        assertEquals("((x := x - 1) + 1)", ExpressionRenderer.render(decrement));
    }

    // ========== ATOMS AND CALLS ==========

    @Test
    void conditionalExpression() {
        Node conditional = new ConditionalExpression(C, A, B, null, null);

        assertEquals("a if c else b", ExpressionRenderer.render(conditional));
        assertEquals("f(a if c else b)", ExpressionRenderer.render(Call.of("f", conditional)));
        assertEquals("(a if c else b) + 1",
                ExpressionRenderer.render(op(conditional, "+", Literal.integer(1))));
    }

    @Test
    void tuplesAndLists() {
        assertEquals("(a,)", ExpressionRenderer.render(new TupleLiteral(List.of(A))));
        assertEquals("(a, b)", ExpressionRenderer.render(new TupleLiteral(List.of(A, B))));
        assertEquals("[]", ExpressionRenderer.render(new ListLiteral(List.of())));
        assertEquals("[0] * n",
                ExpressionRenderer.render(op(new ListLiteral(List.of(Literal.integer(0))), "*", new Identifier("n"))));
    }

    @Test
    void keywordArguments() {
        Node print = new Call(new Identifier("print"), List.of(new Identifier("x")),
                List.of(new KeywordArgument("end", Literal.string(""))), null, null);

        assertEquals("print(x, end=\"\")", ExpressionRenderer.render(print));
    }

    @Test
    void subscriptWithNegativeIndex() {
        Node last = new Subscript(new Identifier("v"), new Literal(LiteralType.INTEGER, "-1", null, "int"), null, null);

        assertEquals("v[-1]", ExpressionRenderer.render(last));
    }

    @Test
    void stringLiteralKeepsEscapes() {
        assertEquals("\"a\\tb\\n\"", ExpressionRenderer.render(Literal.string("a\\tb\\n")));
    }

    @Test
    void remainingCastRendersOperandOnly() {
        assertEquals("x", ExpressionRenderer.render(new Cast("long", new Identifier("x"), null)));
    }

    // ========== NAMES ==========

    @Test
    void namesArePythonSafe() {
        assertEquals("self.count", ExpressionRenderer.render(new MemberAccess(new Identifier("this"), "count")));
        assertEquals("std.max(a, b)", ExpressionRenderer.render(Call.of("std::max", A, B)));
        assertEquals("lambda_", ExpressionRenderer.render(new Identifier("lambda")));
        assertEquals("util.helpers.run", PythonNames.qualified("::util::helpers::run"));
        assertTrue(PythonNames.isKeyword("pass"));
        assertEquals("count", PythonNames.name("count"));
    }
}
