package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.KeywordArgument;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rewrites output stream statements to {@code print} calls.
 *
 * <pre>
 * std::cout &lt;&lt; "x = " &lt;&lt; x &lt;&lt; std::endl;   →  print("x = ", x, sep="")
 * std::cout &lt;&lt; x;                          →  print(x, end="")
 * std::cerr &lt;&lt; "oops\n";                   →  print("oops", file=sys.stderr)
 * </pre>
 *
 * A trailing {@code endl} or {@code "\n"} becomes print's own newline; an {@code endl}
 * in the middle becomes a {@code "\n"} argument.
 */
public class StdCoutToPrintRule implements Rule {

    public static final String NAME = "std-cout-to-print";

    private static final Set<String> OUT_STREAMS = Set.of("std::cout", "cout");
    private static final Set<String> ERR_STREAMS = Set.of("std::cerr", "cerr", "std::clog", "clog");
    private static final Set<String> ENDL = Set.of("std::endl", "endl");
    private static final Set<String> FLUSH = Set.of("std::flush", "flush");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "std::cout << a << std::endl becomes print(a)";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ExpressionStatement)) {
            return node;
        }
        Node expression = ((ExpressionStatement) node).getExpression();
        List<Node> chain = ConsoleStreams.flattenChain(expression, "<<", OUT_STREAMS);
        boolean stderr = false;
        if (chain == null) {
            chain = ConsoleStreams.flattenChain(expression, "<<", ERR_STREAMS);
            stderr = true;
        }
        if (chain == null) {
            return node;
        }

        List<Node> parts = new ArrayList<>();
        for (Node part : chain.subList(1, chain.size())) {
            if (!ConsoleStreams.isIdentifier(part, FLUSH)) {
                parts.add(part);
            }
        }

        boolean newline = false;
        if (!parts.isEmpty()) {
            Node last = parts.get(parts.size() - 1);
            if (ConsoleStreams.isIdentifier(last, ENDL)) {
                parts.remove(parts.size() - 1);
                newline = true;
            } else if (ConsoleStreams.isStringLiteral(last) && ConsoleStreams.endsWithNewline(((Literal) last).getValue())) {
                String body = ConsoleStreams.stripTrailingNewline(((Literal) last).getValue());
                parts.remove(parts.size() - 1);
                if (!body.isEmpty()) {
                    parts.add(new Literal(LiteralType.STRING, body, last.getLocation(), last.getInferredType()));
                }
                newline = true;
            }
        }

        List<Node> arguments = new ArrayList<>();
        for (Node part : parts) {
            arguments.add(ConsoleStreams.isIdentifier(part, ENDL) ? Literal.string("\\n") : part);
        }

        List<KeywordArgument> keywords = new ArrayList<>();
        if (arguments.size() > 1) {
            keywords.add(new KeywordArgument("sep", Literal.string("")));
        }
        if (!newline) {
            keywords.add(new KeywordArgument("end", Literal.string("")));
        }
        if (stderr) {
            keywords.add(new KeywordArgument("file", new MemberAccess(new Identifier("sys"), "stderr")));
        }

        Call print = new Call(new Identifier("print"), arguments, keywords, node.getLocation(), "void");
        return new ExpressionStatement(print, node.getLocation());
    }
}
