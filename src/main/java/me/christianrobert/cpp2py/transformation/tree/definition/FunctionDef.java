package me.christianrobert.cpp2py.transformation.tree.definition;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Function or method definition.
 *
 * <p>The return type is the Python annotation to emit, or null for none (C++ {@code void}
 * and unmapped types). Static member functions carry {@code staticMethod} so that the
 * class rewrite does not add a {@code self} parameter and the generator emits
 * {@code @staticmethod}.</p>
 */
public final class FunctionDef extends Node {

    private final String name;
    private final List<Parameter> parameters;
    private final String returnType;
    private final Block body;
    private final boolean staticMethod;

    public FunctionDef(String name, List<Parameter> parameters, String returnType, Block body,
                       boolean staticMethod, SourceLocation location) {
        super(NodeKind.FUNCTION_DEF, location, null);
        this.name = Nodes.requireName(name, "function name");
        this.parameters = Nodes.requireAll(parameters, Parameter.class, "function parameter");
        this.returnType = returnType;
        this.body = Nodes.requireKind(body, Block.class, "function body");
        this.staticMethod = staticMethod;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public String getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean isStaticMethod() {
        return staticMethod;
    }

    public FunctionDef withName(String newName) {
        return new FunctionDef(newName, parameters, returnType, body, staticMethod, getLocation());
    }

    public FunctionDef withParameters(List<Parameter> newParameters) {
        return new FunctionDef(name, newParameters, returnType, body, staticMethod, getLocation());
    }

    public FunctionDef withBody(Block newBody) {
        return new FunctionDef(name, parameters, returnType, newBody, staticMethod, getLocation());
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        List<Node> newParameters = mapList(parameters, mapper);
        Node newBody = mapper.apply(body);
        if (newParameters == (List<?>) parameters && newBody == body) {
            return this;
        }
        return new FunctionDef(name, Nodes.requireAll(newParameters, Parameter.class, "function parameter"),
                returnType, Nodes.requireKind(newBody, Block.class, "function body"), staticMethod, getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionDef)) {
            return false;
        }
        FunctionDef that = (FunctionDef) o;
        return staticMethod == that.staticMethod
                && name.equals(that.name)
                && parameters.equals(that.parameters)
                && Objects.equals(returnType, that.returnType)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, returnType, body, staticMethod);
    }

    @Override
    public String toString() {
        return "FunctionDef{name='" + name + "', parameters=" + parameters.size() + ", returnType=" + returnType + "}";
    }
}
