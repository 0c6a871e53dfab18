package me.christianrobert.cpp2py.transformation.tree.definition;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Function parameter with an optional Python type hint and an optional default value.
 */
public final class Parameter extends Node {

    private final String name;
    private final String typeHint;
    private final Node defaultValue;

    public Parameter(String name, String typeHint, Node defaultValue, SourceLocation location) {
        super(NodeKind.PARAMETER, location, null);
        this.name = Nodes.requireName(name, "parameter name");
        this.typeHint = typeHint;
        this.defaultValue = Nodes.optionalExpression(defaultValue, "parameter default");
    }

    public Parameter(String name, String typeHint) {
        this(name, typeHint, null, null);
    }

    public String getName() {
        return name;
    }

    public String getTypeHint() {
        return typeHint;
    }

    public Node getDefaultValue() {
        return defaultValue;
    }

    @Override
    public List<Node> getChildren() {
        return defaultValue == null ? List.of() : List.of(defaultValue);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newDefault = mapOptional(defaultValue, mapper);
        if (newDefault == defaultValue) {
            return this;
        }
        return new Parameter(name, typeHint, newDefault, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Parameter)) {
            return false;
        }
        Parameter that = (Parameter) o;
        return name.equals(that.name)
                && Objects.equals(typeHint, that.typeHint)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeHint, defaultValue);
    }

    @Override
    public String toString() {
        return "Parameter{name='" + name + "', typeHint=" + typeHint + "}";
    }
}
