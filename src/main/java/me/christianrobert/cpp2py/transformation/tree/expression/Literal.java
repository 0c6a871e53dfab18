package me.christianrobert.cpp2py.transformation.tree.expression;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Literal already spelled the Python way ({@code 0o17}, {@code True}, {@code None}).
 */
public final class Literal extends Node {

    private final LiteralType type;
    private final String value;

    public Literal(LiteralType type, String value, SourceLocation location, String inferredType) {
        super(NodeKind.LITERAL, location, inferredType);
        this.type = Objects.requireNonNull(type, "type");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Literal integer(long value) {
        return new Literal(LiteralType.INTEGER, Long.toString(value), null, "int");
    }

    public static Literal string(String escapedBody) {
        return new Literal(LiteralType.STRING, escapedBody, null, "std::string");
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralType.BOOLEAN, value ? "True" : "False", null, "bool");
    }

    public static Literal none() {
        return new Literal(LiteralType.NONE, "None", null, null);
    }

    public LiteralType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    /**
     * Integer value of a decimal integer literal, or null for anything else.
     */
    public Long asDecimalInteger() {
        if (type != LiteralType.INTEGER || !value.matches("-?[0-9]+")) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isInteger(long expected) {
        Long actual = asDecimalInteger();
        return actual != null && actual == expected;
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
        if (!(o instanceof Literal)) {
            return false;
        }
        Literal that = (Literal) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return "Literal{" + type + " " + value + "}";
    }
}
