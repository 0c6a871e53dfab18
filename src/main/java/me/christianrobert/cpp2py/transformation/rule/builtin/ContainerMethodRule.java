package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.Subscript;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.type.CppTypeMapper;

import java.util.List;

/**
 * Rewrites standard container and string member calls to Python built-ins and list
 * methods.
 *
 * <table>
 *   <caption>Rewrites</caption>
 *   <tr><td>{@code v.size()}, {@code s.length()}</td><td>{@code len(v)}</td></tr>
 *   <tr><td>{@code v.empty()}</td><td>{@code len(v) == 0}</td></tr>
 *   <tr><td>{@code v.push_back(x)}, {@code v.emplace_back(x)}</td><td>{@code v.append(x)}</td></tr>
 *   <tr><td>{@code v.pop_back()}</td><td>{@code v.pop()}</td></tr>
 *   <tr><td>{@code v.front()}, {@code v.back()}</td><td>{@code v[0]}, {@code v[-1]}</td></tr>
 *   <tr><td>{@code v.at(i)}</td><td>{@code v[i]}</td></tr>
 *   <tr><td>{@code s.c_str()}</td><td>{@code s}</td></tr>
 * </table>
 *
 * Calls on objects whose inferred type is a user class are left alone since the class
 * may define methods with these names.
 */
public class ContainerMethodRule implements Rule {

    public static final String NAME = "container-method";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "v.size(), v.push_back(x), v.empty() become len(v), v.append(x), len(v) == 0";
    }

    @Override
    public Node apply(Node node) {
        if (!(node instanceof Call) || !(((Call) node).getCallee() instanceof MemberAccess)) {
            return node;
        }
        Call call = (Call) node;
        MemberAccess method = (MemberAccess) call.getCallee();
        Node object = method.getObject();
        if (!isLibraryValue(object)) {
            return node;
        }
        List<Node> arguments = call.getArguments();
        String elementType = elementType(object.getInferredType());

        switch (method.getAttribute()) {
            case "size":
            case "length":
                if (!arguments.isEmpty()) {
                    return node;
                }
                return new Call(new Identifier("len"), List.of(object), List.of(), call.getLocation(), "int");
            case "empty":
                if (!arguments.isEmpty()) {
                    return node;
                }
                Node length = new Call(new Identifier("len"), List.of(object), List.of(), null, "int");
                return new BinaryOp(length, "==", Literal.integer(0), call.getLocation(), "bool");
            case "push_back":
            case "emplace_back":
                if (arguments.size() != 1) {
                    return node;
                }
                return new Call(new MemberAccess(object, "append"), arguments, List.of(), call.getLocation(), "void");
            case "pop_back":
                if (!arguments.isEmpty()) {
                    return node;
                }
                return new Call(new MemberAccess(object, "pop"), List.of(), List.of(), call.getLocation(), elementType);
            case "front":
                if (!arguments.isEmpty()) {
                    return node;
                }
                return new Subscript(object, Literal.integer(0), call.getLocation(), elementType);
            case "back":
                if (!arguments.isEmpty()) {
                    return node;
                }
                Node last = new UnaryOp("-", Literal.integer(1), false, null, "int");
                return new Subscript(object, last, call.getLocation(), elementType);
            case "at":
                if (arguments.size() != 1) {
                    return node;
                }
                return new Subscript(object, arguments.get(0), call.getLocation(), elementType);
            case "c_str":
                return arguments.isEmpty() ? object : node;
            default:
                return node;
        }
    }

    /**
     * Containers, strings, and values whose type could not be inferred.
     */
    private static boolean isLibraryValue(Node object) {
        String type = object.getInferredType();
        return type == null || CppTypeMapper.isContainer(type) || CppTypeMapper.isString(type)
                || type.startsWith("std::");
    }

    private static String elementType(String containerType) {
        if ("std::string".equals(containerType)) {
            return "char";
        }
        List<String> arguments = CppTypeMapper.templateArguments(containerType);
        return arguments.isEmpty() ? null : arguments.get(0);
    }
}
