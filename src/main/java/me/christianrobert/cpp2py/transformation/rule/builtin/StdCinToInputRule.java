package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites input stream statements to assignments from {@code input()}.
 *
 * <pre>
 * std::cin &gt;&gt; n;        →  n = int(input())
 * std::cin &gt;&gt; a &gt;&gt; b;   →  a, b = map(int, input().split())     (same type)
 * std::cin &gt;&gt; n &gt;&gt; s;   →  n, s = int(input()), input()         (mixed types)
 * </pre>
 *
 * Values are converted by the inferred type of the target: integral to {@code int},
 * floating to {@code float}, anything else read as a string.
 */
public class StdCinToInputRule implements Rule {

    public static final String NAME = "std-cin-to-input";

    private static final Set<String> IN_STREAMS = Set.of("std::cin", "cin");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "std::cin >> n becomes n = int(input())";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ExpressionStatement)) {
            return node;
        }
        List<Node> chain = ConsoleStreams.flattenChain(((ExpressionStatement) node).getExpression(), ">>", IN_STREAMS);
        if (chain == null) {
            return node;
        }
        List<Node> targets = chain.subList(1, chain.size());
        for (Node target : targets) {
            switch (target.getKind()) {
                case IDENTIFIER:
                case MEMBER_ACCESS:
                case SUBSCRIPT:
                    break;
                default:
                    return node;
            }
        }

        if (targets.size() == 1) {
            Node target = targets.get(0);
            return new Assignment(target, readOne(converterFor(target)), node.getLocation());
        }

        Set<String> converters = new HashSet<>();
        targets.forEach(t -> converters.add(String.valueOf(converterFor(t))));
        Node value;
        if (converters.size() == 1) {
            String converter = converterFor(targets.get(0));
            Call split = new Call(new MemberAccess(Call.of("input"), "split"), List.of());
            value = converter == null
                    ? split
                    : Call.of("map", new Identifier(converter), split);
        } else {
            List<Node> reads = new ArrayList<>();
            for (Node target : targets) {
                reads.add(readOne(converterFor(target)));
            }
            value = new TupleLiteral(reads);
        }
        return new Assignment(new TupleLiteral(targets), value, node.getLocation());
    }

    private static Node readOne(String converter) {
        Call read = Call.of("input");
        return converter == null ? read : Call.of(converter, read);
    }

    private static String converterFor(Node target) {
        String type = target.getInferredType();
        if (CppTypeMapper.isIntegral(type)) {
            return "int";
        }
        if (CppTypeMapper.isFloating(type)) {
            return "float";
        }
        return null;
    }
}
