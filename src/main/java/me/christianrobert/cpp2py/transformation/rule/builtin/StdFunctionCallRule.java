package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;

import java.util.Map;

/**
 * Rewrites calls to standard library free functions to their Python counterparts,
 * e.g. {@code std::to_string(n)} → {@code str(n)}, {@code sqrt(x)} → {@code math.sqrt(x)},
 * {@code std::max(a, b)} → {@code max(a, b)}.
 */
public class StdFunctionCallRule implements Rule {

    public static final String NAME = "std-function-call";

    // C++ name (without std::) -> Python callee; "math." prefix means an attribute of the math module
    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("to_string", "str"),
            Map.entry("string", "str"),
            Map.entry("stoi", "int"),
            Map.entry("stol", "int"),
            Map.entry("stoll", "int"),
            Map.entry("atoi", "int"),
            Map.entry("stod", "float"),
            Map.entry("stof", "float"),
            Map.entry("atof", "float"),
            Map.entry("abs", "abs"),
            Map.entry("fabs", "abs"),
            Map.entry("min", "min"),
            Map.entry("max", "max"),
            Map.entry("sqrt", "math.sqrt"),
            Map.entry("pow", "math.pow"),
            Map.entry("floor", "math.floor"),
            Map.entry("ceil", "math.ceil"),
            Map.entry("sin", "math.sin"),
            Map.entry("cos", "math.cos"),
            Map.entry("tan", "math.tan"),
            Map.entry("exp", "math.exp"),
            Map.entry("log", "math.log"),
            Map.entry("log10", "math.log10"),
            Map.entry("hypot", "math.hypot"));

    private static final Map<String, String> RESULT_TYPES = Map.of(
            "str", "std::string",
            "int", "int",
            "float", "double");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "std::to_string, std::stoi, sqrt, std::max and friends become str, int, math.sqrt, max";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof Call) || !(((Call) node).getCallee() instanceof Identifier)) {
            return node;
        }
        Call call = (Call) node;
        Identifier callee = (Identifier) call.getCallee();
        String replacement = FUNCTIONS.get(callee.getUnqualifiedStdName());
        if (replacement == null) {
            return node;
        }

        Node newCallee = replacement.startsWith("math.")
                ? new MemberAccess(new Identifier("math"), replacement.substring(5))
                : new Identifier(replacement);
        String type = call.getInferredType() != null ? call.getInferredType() : RESULT_TYPES.get(replacement);
        return new Call(newCallee, call.getArguments(), call.getKeywords(), call.getLocation(), type);
    }
}
