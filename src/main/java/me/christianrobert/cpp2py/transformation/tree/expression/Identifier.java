package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Name reference. Qualified C++ names keep their {@code ::} separators (e.g. {@code std::cout})
 * so that rules can match them; the generator renders {@code ::} as {@code .}.
 */
public final class Identifier extends Node {

    private final String name;

    public Identifier(String name, SourceLocation location, String inferredType) {
        super(NodeKind.IDENTIFIER, location, inferredType);
        this.name = Nodes.requireName(name, "identifier");
    }

    public Identifier(String name) {
        this(name, null, null);
    }

    public String getName() {
        return name;
    }

    /**
     * Name without a leading {@code std::} qualifier.
     */
    public String getUnqualifiedStdName() {
        return name.startsWith("std::") ? name.substring(5) : name;
    }

    @Override
    public List<Node> getChildren() {
        return List.of();
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier && name.equals(((Identifier) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Identifier{name='" + name + "'}";
    }
}
