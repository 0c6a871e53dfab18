package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Pass-through for C++ that could not be translated. Holds the verbatim source span
 * and the reason; the generator renders it as a marked comment block.
 */
public final class Opaque extends Node {

    private final String text;
    private final String reason;

    public Opaque(String text, String reason, SourceLocation location) {
        super(NodeKind.OPAQUE, location, null);
        this.text = Objects.requireNonNull(text, "text");
        this.reason = Nodes.requireName(reason, "opaque reason");
    }

    public String getText() {
        return text;
    }

    public String getReason() {
        return reason;
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
        if (!(o instanceof Opaque)) {
            return false;
        }
        Opaque that = (Opaque) o;
        return text.equals(that.text) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, reason);
    }

    @Override
    public String toString() {
        return "Opaque{reason='" + reason + "'}";
    }
}
