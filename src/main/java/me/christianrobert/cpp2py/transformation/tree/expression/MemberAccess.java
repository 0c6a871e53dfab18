package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Attribute access {@code object.attribute}; C++ {@code ->} converts to this as well.
 */
public final class MemberAccess extends Node {

    private final Node object;
    private final String attribute;

    public MemberAccess(Node object, String attribute, SourceLocation location, String inferredType) {
        super(NodeKind.MEMBER_ACCESS, location, inferredType);
        this.object = Nodes.requireExpression(object, "member object");
        this.attribute = Nodes.requireName(attribute, "member name");
    }

    public MemberAccess(Node object, String attribute) {
        this(object, attribute, null, null);
    }

    public Node getObject() {
        return object;
    }

    public String getAttribute() {
        return attribute;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(object);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newObject = mapper.apply(object);
        if (newObject == object) {
            return this;
        }
        return new MemberAccess(newObject, attribute, getLocation(), getInferredType());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MemberAccess)) {
            return false;
        }
        MemberAccess that = (MemberAccess) o;
        return object.equals(that.object) && attribute.equals(that.attribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(object, attribute);
    }

    @Override
    public String toString() {
        return "MemberAccess{" + object + "." + attribute + "}";
    }
}
