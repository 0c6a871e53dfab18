package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Function or method call with positional and keyword arguments.
 */
public final class Call extends Node {

    private final Node callee;
    private final List<Node> arguments;
    private final List<KeywordArgument> keywords;

    public Call(Node callee, List<? extends Node> arguments, List<KeywordArgument> keywords,
                SourceLocation location, String inferredType) {
        super(NodeKind.CALL, location, inferredType);
        this.callee = Nodes.requireExpression(callee, "callee");
        this.arguments = Nodes.requireExpressions(arguments, "call argument");
        this.keywords = Nodes.requireAll(keywords, KeywordArgument.class, "keyword argument");
    }

    public Call(Node callee, List<? extends Node> arguments) {
        this(callee, arguments, List.of(), null, null);
    }

    /**
     * Call of a plain function name, e.g. {@code Call.of("len", x)}.
     */
    public static Call of(String function, Node... arguments) {
        return new Call(new Identifier(function), List.of(arguments));
    }

    public Node getCallee() {
        return callee;
    }

    /**
     * Callee name when the callee is a plain identifier, null otherwise.
     */
    public String getFunctionName() {
        return callee instanceof Identifier ? ((Identifier) callee).getName() : null;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    public List<KeywordArgument> getKeywords() {
        return keywords;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(1 + arguments.size() + keywords.size());
        children.add(callee);
        children.addAll(arguments);
        children.addAll(keywords);
        return children;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newCallee = mapper.apply(callee);
        List<Node> newArguments = mapList(arguments, mapper);
        List<Node> newKeywords = mapList(keywords, mapper);
        if (newCallee == callee && newArguments == arguments && newKeywords == (List<?>) keywords) {
            return this;
        }
        return new Call(newCallee, newArguments,
                Nodes.requireAll(newKeywords, KeywordArgument.class, "keyword argument"),
                getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Call)) {
            return false;
        }
        Call that = (Call) o;
        return callee.equals(that.callee) && arguments.equals(that.arguments) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, arguments, keywords);
    }

    @Override
    public String toString() {
        return "Call{callee=" + callee + ", arguments=" + arguments.size() + ", keywords=" + keywords.size() + "}";
    }
}
