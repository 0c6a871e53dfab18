package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * {@code name=value} argument of a call.
 */
public final class KeywordArgument extends Node {

    private final String name;
    private final Node value;

    public KeywordArgument(String name, Node value) {
        super(NodeKind.KEYWORD_ARGUMENT, null, null);
        this.name = Nodes.requireName(name, "keyword name");
        this.value = Nodes.requireExpression(value, "keyword value");
    }

    public String getName() {
        return name;
    }

    public Node getValue() {
        return value;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(value);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newValue = mapper.apply(value);
        if (newValue == value) {
            return this;
        }
        return new KeywordArgument(name, newValue);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof KeywordArgument)) {
            return false;
        }
        KeywordArgument that = (KeywordArgument) o;
        return name.equals(that.name) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value);
    }

    @Override
    public String toString() {
        return "KeywordArgument{" + name + "=" + value + "}";
    }
}
