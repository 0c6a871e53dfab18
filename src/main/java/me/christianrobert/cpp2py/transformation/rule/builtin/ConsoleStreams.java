package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Helpers shared by the console I/O rules.
 */
final class ConsoleStreams {

    private ConsoleStreams() {
    }

    /**
     * Operands of a left-nested chain {@code ((s OP a) OP b) OP c} rooted at one of the
     * given stream names, as {@code [s, a, b, c]}; null when the expression is not such a
     * chain.
     */
    static List<Node> flattenChain(Node expression, String operator, Set<String> streams) {
        Deque<Node> operands = new ArrayDeque<>();
        Node current = expression;
        while (current instanceof BinaryOp && operator.equals(((BinaryOp) current).getOperator())) {
            operands.addFirst(((BinaryOp) current).getRight());
            current = ((BinaryOp) current).getLeft();
        }
        if (operands.isEmpty() || !(current instanceof Identifier)
                || !streams.contains(((Identifier) current).getName())) {
            return null;
        }
        operands.addFirst(current);
        return List.copyOf(operands);
    }

    static boolean isIdentifier(Node node, Set<String> names) {
        return node instanceof Identifier && names.contains(((Identifier) node).getName());
    }

    static boolean isStringLiteral(Node node) {
        return node instanceof Literal && ((Literal) node).getType() == LiteralType.STRING;
    }

    /**
     * True when an escaped string body ends with an unescaped {@code \n}.
     */
    static boolean endsWithNewline(String escapedBody) {
        if (!escapedBody.endsWith("\\n")) {
            return false;
        }
        int backslashes = 0;
        for (int i = escapedBody.length() - 2; i >= 0 && escapedBody.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    static String stripTrailingNewline(String escapedBody) {
        return escapedBody.substring(0, escapedBody.length() - 2);
    }
}
