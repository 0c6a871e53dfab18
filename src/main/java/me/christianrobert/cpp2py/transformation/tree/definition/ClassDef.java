package me.christianrobert.cpp2py.transformation.tree.definition;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Class definition. Members are statements: field assignments, methods, and opaque
 * pass-through for members that could not be converted.
 */
public final class ClassDef extends Node {

    private final String name;
    private final List<String> bases;
    private final List<Node> body;

    public ClassDef(String name, List<String> bases, List<? extends Node> body, SourceLocation location) {
        super(NodeKind.CLASS_DEF, location, null);
        this.name = Nodes.requireName(name, "class name");
        this.bases = List.copyOf(bases);
        this.body = Nodes.requireStatements(body, "class body");
    }

    public String getName() {
        return name;
    }

    public List<String> getBases() {
        return bases;
    }

    public List<Node> getBody() {
        return body;
    }

    public ClassDef withBody(List<? extends Node> newBody) {
        return new ClassDef(name, bases, newBody, getLocation());
    }

    @Override
    public List<Node> getChildren() {
        return body;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        List<Node> newBody = mapList(body, mapper);
        if (newBody == body) {
            return this;
        }
        return new ClassDef(name, bases, newBody, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ClassDef)) {
            return false;
        }
        ClassDef that = (ClassDef) o;
        return name.equals(that.name) && bases.equals(that.bases) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, bases, body);
    }

    @Override
    public String toString() {
        return "ClassDef{name='" + name + "', bases=" + bases + ", members=" + body.size() + "}";
    }
}
