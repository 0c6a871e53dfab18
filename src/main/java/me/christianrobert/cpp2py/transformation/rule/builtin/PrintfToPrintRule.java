package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.KeywordArgument;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code printf("fmt", args...)} statements to {@code print("fmt" % (args,), end="")}.
 *
 * <p>Length modifiers ({@code l}, {@code ll}, {@code h}, {@code z}...) are dropped from
 * the conversion specifications since Python's {@code %} operator has no use for them;
 * {@code %u} becomes {@code %d}. A trailing {@code \n} becomes print's own newline.
 * Only literal format strings are handled.</p>
 */
public class PrintfToPrintRule implements Rule {

    public static final String NAME = "printf-to-print";

    private static final Set<String> PRINTF = Set.of("printf", "std::printf");

    private static final Pattern CONVERSION =
            Pattern.compile("%([-+ #0]*[0-9]*(?:\\.[0-9]+)?)(hh|h|ll|l|L|z|j|t)?([diouxXeEfFgGcs%])");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "printf(\"%d\\n\", x) becomes print(\"%d\" % (x,))";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof ExpressionStatement) || !(((ExpressionStatement) node).getExpression() instanceof Call)) {
            return node;
        }
        Call call = (Call) ((ExpressionStatement) node).getExpression();
        String name = call.getFunctionName();
        if (name == null || !PRINTF.contains(name) || call.getArguments().isEmpty()
                || !ConsoleStreams.isStringLiteral(call.getArguments().get(0))) {
            return node;
        }

        Literal format = (Literal) call.getArguments().get(0);
        List<Node> values = call.getArguments().subList(1, call.getArguments().size());
        String body = normalizeFormat(format.getValue());
        boolean newline = ConsoleStreams.endsWithNewline(body);
        if (newline) {
            body = ConsoleStreams.stripTrailingNewline(body);
        }

        List<Node> arguments = new ArrayList<>();
        if (values.isEmpty()) {
            // no % operator applies, so %% must be written as a single percent sign
            String text = body.replace("%%", "%");
            if (!text.isEmpty() || !newline) {
                arguments.add(new Literal(LiteralType.STRING, text, format.getLocation(), "std::string"));
            }
        } else {
            Literal pattern = new Literal(LiteralType.STRING, body, format.getLocation(), "std::string");
            arguments.add(new BinaryOp(pattern, "%", new TupleLiteral(values), call.getLocation(), "std::string"));
        }

        List<KeywordArgument> keywords = newline
                ? List.of()
                : List.of(new KeywordArgument("end", Literal.string("")));
        Call print = new Call(new Identifier("print"), arguments, keywords, call.getLocation(), "void");
        return new ExpressionStatement(print, node.getLocation());
    }

    static String normalizeFormat(String format) {
        Matcher matcher = CONVERSION.matcher(format);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String conversion = matcher.group(3);
            if ("u".equals(conversion)) {
                conversion = "d";
            } else if ("F".equals(conversion)) {
                conversion = "f";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement("%" + matcher.group(1) + conversion));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
