package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.context.StructuralException;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Plain or augmented assignment. Declarations convert to assignments with
 * {@code declaration == true}; their type hint (if the C++ type maps to a Python type)
 * renders as an annotation: {@code x: int = 5}.
 */
public final class Assignment extends Node {

    private static final Set<String> OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "//=", "%=", "<<=", ">>=", "&=", "^=", "|=");

    private static final Set<NodeKind> TARGET_KINDS = Set.of(
            NodeKind.IDENTIFIER, NodeKind.MEMBER_ACCESS, NodeKind.SUBSCRIPT, NodeKind.TUPLE_LITERAL);

    private final Node target;
    private final String operator;
    private final Node value;
    private final String typeHint;
    private final boolean declaration;

    public Assignment(Node target, String operator, Node value, String typeHint, boolean declaration,
                      SourceLocation location) {
        super(NodeKind.ASSIGNMENT, location, null);
        this.target = Nodes.requireExpression(target, "assignment target");
        if (!TARGET_KINDS.contains(target.getKind())) {
            throw new StructuralException("assignment target cannot be " + target.getKind());
        }
        if (!OPERATORS.contains(operator)) {
            throw new StructuralException("unknown assignment operator '" + operator + "'");
        }
        this.operator = operator;
        this.value = Nodes.requireExpression(value, "assignment value");
        this.typeHint = typeHint;
        this.declaration = declaration;
    }

    /**
     * Plain {@code target = value} that is not a declaration.
     */
    public Assignment(Node target, Node value, SourceLocation location) {
        this(target, "=", value, null, false, location);
    }

    public Node getTarget() {
        return target;
    }

    public String getOperator() {
        return operator;
    }

    public boolean isAugmented() {
        return !"=".equals(operator);
    }

    public Node getValue() {
        return value;
    }

    public String getTypeHint() {
        return typeHint;
    }

    public boolean isDeclaration() {
        return declaration;
    }

    @Override
    public List<Node> getChildren() {
        return List.of(target, value);
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newTarget = mapper.apply(target);
        Node newValue = mapper.apply(value);
        if (newTarget == target && newValue == value) {
            return this;
        }
        return new Assignment(newTarget, operator, newValue, typeHint, declaration, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return declaration == that.declaration
                && target.equals(that.target)
                && operator.equals(that.operator)
                && value.equals(that.value)
                && Objects.equals(typeHint, that.typeHint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, operator, value, typeHint, declaration);
    }

    @Override
    public String toString() {
        return "Assignment{target=" + target + ", operator='" + operator + "', value=" + value
                + (typeHint != null ? ", typeHint=" + typeHint : "") + "}";
    }
}
