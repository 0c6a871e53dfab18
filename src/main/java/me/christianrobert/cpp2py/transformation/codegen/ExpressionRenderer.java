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
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.Subscript;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders expression nodes as Python source, inserting parentheses only where Python's
 * operator precedence requires them.
 *
 * <p>Comparisons are never chained: {@code (a < b) == c} keeps its parentheses because
 * Python would read {@code a < b == c} as {@code a < b and b == c}.</p>
 */
final class ExpressionRenderer {

    // Python precedence, lowest to highest
    static final int WALRUS = 0;
    static final int CONDITIONAL = 1;
    static final int OR = 2;
    static final int AND = 3;
    static final int NOT = 4;
    static final int COMPARISON = 5;
    static final int BIT_OR = 6;
    static final int BIT_XOR = 7;
    static final int BIT_AND = 8;
    static final int SHIFT = 9;
    static final int ADDITIVE = 10;
    static final int MULTIPLICATIVE = 11;
    static final int UNARY = 12;
    static final int PRIMARY = 13;
    static final int ATOM = 14;

    private ExpressionRenderer() {
    }

    static String render(Node node) {
        return rendered(node).text;
    }

    /**
     * Rendering of {@code node}, parenthesized if it binds looser than {@code minimum}.
     */
    static String render(Node node, int minimum) {
        Rendered result = rendered(node);
        return result.precedence < minimum ? "(" + result.text + ")" : result.text;
    }

    /**
     * Comma-separated elements without surrounding brackets, as used for tuple targets and
     * tuple values of assignments.
     */
    static String renderBare(List<Node> elements) {
        List<String> parts = new ArrayList<>();
        for (Node element : elements) {
            parts.add(render(element, CONDITIONAL));
        }
        return String.join(", ", parts);
    }

    private static Rendered rendered(Node node) {
        switch (node.getKind()) {
            case IDENTIFIER:
                return new Rendered(identifier((Identifier) node), ATOM);
            case LITERAL:
                return literal((Literal) node);
            case BINARY_OP:
                return binary((BinaryOp) node);
            case UNARY_OP:
                return unary((UnaryOp) node);
            case CALL:
                return new Rendered(call((Call) node), PRIMARY);
            case MEMBER_ACCESS: {
                MemberAccess access = (MemberAccess) node;
                return new Rendered(render(access.getObject(), PRIMARY) + "." + PythonNames.name(access.getAttribute()),
                        PRIMARY);
            }
            case SUBSCRIPT: {
                Subscript subscript = (Subscript) node;
                return new Rendered(render(subscript.getValue(), PRIMARY) + "[" + render(subscript.getIndex()) + "]",
                        PRIMARY);
            }
            case CAST:
                // casts no rule turned into a conversion call keep only their operand
                return rendered(((Cast) node).getOperand());
            case CONDITIONAL_EXPRESSION: {
                ConditionalExpression conditional = (ConditionalExpression) node;
                String text = render(conditional.getWhenTrue(), OR) + " if " + render(conditional.getCondition(), OR)
                        + " else " + render(conditional.getWhenFalse(), CONDITIONAL);
                return new Rendered(text, CONDITIONAL);
            }
            case LIST_LITERAL:
                return new Rendered("[" + renderBare(((ListLiteral) node).getElements()) + "]", ATOM);
            case TUPLE_LITERAL: {
                List<Node> elements = ((TupleLiteral) node).getElements();
                String body = renderBare(elements);
                return new Rendered("(" + body + (elements.size() == 1 ? ",)" : ")"), ATOM);
            }
            case KEYWORD_ARGUMENT: {
                KeywordArgument keyword = (KeywordArgument) node;
                return new Rendered(keyword.getName() + "=" + render(keyword.getValue(), CONDITIONAL), WALRUS);
            }
            default:
                throw new IllegalArgumentException("Not an expression: " + node.getKind());
        }
    }

    private static String identifier(Identifier identifier) {
        if ("this".equals(identifier.getName())) {
            return "self";
        }
        return PythonNames.qualified(identifier.getName());
    }

    private static Rendered literal(Literal literal) {
        switch (literal.getType()) {
            case STRING:
                return new Rendered("\"" + literal.getValue() + "\"", ATOM);
            case INTEGER:
            case FLOAT:
                return new Rendered(literal.getValue(), literal.getValue().startsWith("-") ? UNARY : ATOM);
            default:
                return new Rendered(literal.getValue(), ATOM);
        }
    }

    private static Rendered binary(BinaryOp binary) {
        String operator = binary.getOperator();
        int precedence = precedenceOf(operator);
        boolean comparison = precedence == COMPARISON;
        String left = render(binary.getLeft(), comparison ? precedence + 1 : precedence);
        String right = render(binary.getRight(), precedence + 1);
        return new Rendered(left + " " + operator + " " + right, precedence);
    }

    private static Rendered unary(UnaryOp unary) {
        String operator = unary.getOperator();
        switch (operator) {
            case "not":
                return new Rendered("not " + render(unary.getOperand(), NOT), NOT);
            case "++":
            case "--": {
                String target = render(unary.getOperand(), ATOM);
                String sign = "++".equals(operator) ? "+" : "-";
                String assignment = "(" + target + " := " + target + " " + sign + " 1)";
                if (!unary.isPostfix()) {
                    return new Rendered(assignment, ATOM);
                }
                String undo = "++".equals(operator) ? "-" : "+";
                return new Rendered("(" + assignment + " " + undo + " 1)", ATOM);
            }
            default:
                return new Rendered(operator + render(unary.getOperand(), UNARY), UNARY);
        }
    }

    private static String call(Call call) {
        List<String> arguments = new ArrayList<>();
        for (Node argument : call.getArguments()) {
            arguments.add(render(argument, CONDITIONAL));
        }
        for (KeywordArgument keyword : call.getKeywords()) {
            arguments.add(render(keyword));
        }
        return render(call.getCallee(), PRIMARY) + "(" + String.join(", ", arguments) + ")";
    }

    static int precedenceOf(String operator) {
        switch (operator) {
            case "or":
                return OR;
            case "and":
                return AND;
            case "<":
            case "<=":
            case ">":
            case ">=":
            case "==":
            case "!=":
            case "in":
            case "is":
                return COMPARISON;
            case "|":
                return BIT_OR;
            case "^":
                return BIT_XOR;
            case "&":
                return BIT_AND;
            case "<<":
            case ">>":
                return SHIFT;
            case "+":
            case "-":
                return ADDITIVE;
            case "*":
            case "/":
            case "//":
            case "%":
                return MULTIPLICATIVE;
            default:
                throw new IllegalArgumentException("Unknown binary operator '" + operator + "'");
        }
    }

    private static final class Rendered {
        private final String text;
        private final int precedence;

        Rendered(String text, int precedence) {
            this.text = text;
            this.precedence = precedence;
        }
    }
}
