package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * C-style counting loop {@code for (init; condition; step) body}, kept with its four
 * slots so that loop rules can recognise canonical counting patterns. Init and step are
 * statements (assignment or expression statement); every slot except the body is optional.
 */
public final class ForLoop extends Node {

    private final Node init;
    private final Node condition;
    private final Node step;
    private final Block body;

    public ForLoop(Node init, Node condition, Node step, Block body, SourceLocation location) {
        super(NodeKind.FOR_LOOP, location, null);
        this.init = init == null ? null : Nodes.requireStatement(init, "for-loop init");
        this.condition = Nodes.optionalExpression(condition, "for-loop condition");
        this.step = step == null ? null : Nodes.requireStatement(step, "for-loop step");
        this.body = Nodes.requireKind(body, Block.class, "for-loop body");
    }

    public Node getInit() {
        return init;
    }

    public Node getCondition() {
        return condition;
    }

    public Node getStep() {
        return step;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(4);
        if (init != null) {
            children.add(init);
        }
        if (condition != null) {
            children.add(condition);
        }
        if (step != null) {
            children.add(step);
        }
        children.add(body);
        return children;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newInit = mapOptional(init, mapper);
        Node newCondition = mapOptional(condition, mapper);
        Node newStep = mapOptional(step, mapper);
        Node newBody = mapper.apply(body);
        if (newInit == init && newCondition == condition && newStep == step && newBody == body) {
            return this;
        }
        return new ForLoop(newInit, newCondition, newStep,
                Nodes.requireKind(newBody, Block.class, "for-loop body"), getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ForLoop)) {
            return false;
        }
        ForLoop that = (ForLoop) o;
        return Objects.equals(init, that.init)
                && Objects.equals(condition, that.condition)
                && Objects.equals(step, that.step)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.FOR_LOOP, init, condition, step, body);
    }

    @Override
    public String toString() {
        return "ForLoop{init=" + init + ", condition=" + condition + ", step=" + step + "}";
    }
}
