package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rewrites counting loops to {@code for v in range(...)}.
 *
 * <p>Matches {@code for (v = start; v OP bound; STEP)} where STEP moves {@code v} by a
 * constant integer ({@code v++}, {@code v--}, {@code v += k}, {@code v -= k},
 * {@code v = v + k}) in the direction the comparison requires. The body must not
 * assign the loop variable or any variable the bound reads, otherwise the C++ loop
 * could run a different number of times than the range.</p>
 *
 * <table>
 *   <caption>Bound mapping</caption>
 *   <tr><td>{@code v < n}</td><td>{@code range(start, n, step)}</td></tr>
 *   <tr><td>{@code v <= n}</td><td>{@code range(start, n + 1, step)}</td></tr>
 *   <tr><td>{@code v > n}</td><td>{@code range(start, n, -step)}</td></tr>
 *   <tr><td>{@code v >= n}</td><td>{@code range(start, n - 1, -step)}</td></tr>
 *   <tr><td>{@code v != n}</td><td>same as {@code <} or {@code >} for a unit step</td></tr>
 * </table>
 */
public class ForLoopToRangeRule implements Rule {

    public static final String NAME = "for-loop-to-range";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "for (int i = a; i < b; i++) becomes for i in range(a, b)";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ForLoop)) {
            return node;
        }
        ForLoop loop = (ForLoop) node;
        if (!(loop.getInit() instanceof Assignment) || !(loop.getCondition() instanceof BinaryOp)
                || loop.getStep() == null) {
            return node;
        }

        Assignment init = (Assignment) loop.getInit();
        if (init.isAugmented() || !(init.getTarget() instanceof Identifier)) {
            return node;
        }
        String variable = ((Identifier) init.getTarget()).getName();
        Node start = init.getValue();
        if (!isIntegerTyped(init.getTarget(), start)) {
            return node;
        }

        Long delta = stepDelta(loop.getStep(), variable);
        if (delta == null || delta == 0) {
            return node;
        }

        BinaryOp condition = (BinaryOp) loop.getCondition();
        if (!isVariable(condition.getLeft(), variable) || Nodes.referencesName(condition.getRight(), variable)) {
            return node;
        }
        Node bound = condition.getRight();
        if (bound instanceof Literal && ((Literal) bound).getType() == LiteralType.FLOAT) {
            return node;
        }

        Node stop;
        switch (condition.getOperator()) {
            case "<":
                if (delta < 0) {
                    return node;
                }
                stop = bound;
                break;
            case "<=":
                if (delta < 0) {
                    return node;
                }
                stop = offset(bound, 1);
                break;
            case ">":
                if (delta > 0) {
                    return node;
                }
                stop = bound;
                break;
            case ">=":
                if (delta > 0) {
                    return node;
                }
                stop = offset(bound, -1);
                break;
            case "!=":
                if (Math.abs(delta) != 1) {
                    return node;
                }
                stop = bound;
                break;
            default:
                return node;
        }

        Set<String> guarded = Nodes.descendants(bound)
                .filter(n -> n instanceof Identifier)
                .map(n -> ((Identifier) n).getName())
                .collect(Collectors.toCollection(HashSet::new));
        guarded.add(variable);
        if (assignsAny(loop.getBody(), guarded)) {
            return node;
        }

        Node step = delta == 1 ? null : Literal.integer(delta);
        return new ForRange(variable, start, stop, step, loop.getBody(), loop.getLocation());
    }

    private static boolean isIntegerTyped(Node target, Node start) {
        if (start instanceof Literal) {
            return ((Literal) start).getType() == LiteralType.INTEGER;
        }
        String type = target.getInferredType() != null ? target.getInferredType() : start.getInferredType();
        return type == null || CppTypeMapper.isIntegral(type);
    }

    /**
     * Signed constant by which the step statement moves the variable, or null if the
     * step is anything else.
     */
    private static Long stepDelta(Node step, String variable) {
        if (step instanceof ExpressionStatement
                && ((ExpressionStatement) step).getExpression() instanceof UnaryOp) {
            UnaryOp unary = (UnaryOp) ((ExpressionStatement) step).getExpression();
            if (!isVariable(unary.getOperand(), variable)) {
                return null;
            }
            switch (unary.getOperator()) {
                case "++":
                    return 1L;
                case "--":
                    return -1L;
                default:
                    return null;
            }
        }
        if (!(step instanceof Assignment)) {
            return null;
        }
        Assignment assignment = (Assignment) step;
        if (!isVariable(assignment.getTarget(), variable)) {
            return null;
        }
        switch (assignment.getOperator()) {
            case "+=":
                return constant(assignment.getValue());
            case "-=":
                return negate(constant(assignment.getValue()));
            case "=":
                if (!(assignment.getValue() instanceof BinaryOp)) {
                    return null;
                }
                BinaryOp sum = (BinaryOp) assignment.getValue();
                if (!isVariable(sum.getLeft(), variable)) {
                    return null;
                }
                if ("+".equals(sum.getOperator())) {
                    return constant(sum.getRight());
                }
                if ("-".equals(sum.getOperator())) {
                    return negate(constant(sum.getRight()));
                }
                return null;
            default:
                return null;
        }
    }

    private static Long constant(Node node) {
        if (!(node instanceof Literal)) {
            return null;
        }
        Long value = ((Literal) node).asDecimalInteger();
        return value != null && value > 0 ? value : null;
    }

    private static Long negate(Long value) {
        return value == null ? null : -value;
    }

    private static boolean isVariable(Node node, String variable) {
        return node instanceof Identifier && ((Identifier) node).getName().equals(variable);
    }

    /**
     * {@code bound + amount}, folded when the bound is an integer literal.
     */
    private static Node offset(Node bound, long amount) {
        if (bound instanceof Literal && ((Literal) bound).asDecimalInteger() != null) {
            return Literal.integer(((Literal) bound).asDecimalInteger() + amount);
        }
        String operator = amount > 0 ? "+" : "-";
        return new BinaryOp(bound, operator, Literal.integer(Math.abs(amount)), null, bound.getInferredType());
    }

    /**
     * True when the body may change one of the names: assignment (including tuple
     * targets), increment, loop target, or a method call on the named object.
     */
    private static boolean assignsAny(Node body, Set<String> names) {
        return Nodes.descendants(body).anyMatch(n -> {
            if (n instanceof Assignment) {
                return assignsTo(((Assignment) n).getTarget(), names);
            }
            if (n instanceof UnaryOp && ((UnaryOp) n).isIncrementOrDecrement()) {
                return assignsTo(((UnaryOp) n).getOperand(), names);
            }
            if (n instanceof ForRange) {
                return names.contains(((ForRange) n).getTarget());
            }
            if (n instanceof ForEach) {
                return names.contains(((ForEach) n).getTarget());
            }
            if (n instanceof Call && ((Call) n).getCallee() instanceof MemberAccess) {
                return assignsTo(((MemberAccess) ((Call) n).getCallee()).getObject(), names);
            }
            return false;
        });
    }

    private static boolean assignsTo(Node target, Set<String> names) {
        if (target instanceof Identifier) {
            return names.contains(((Identifier) target).getName());
        }
        if (target instanceof TupleLiteral) {
            return ((TupleLiteral) target).getElements().stream().anyMatch(e -> assignsTo(e, names));
        }
        return false;
    }
}
