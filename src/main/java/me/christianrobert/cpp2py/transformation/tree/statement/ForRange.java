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
 * Python counting loop {@code for target in range(start, stop, step)}. Stop is exclusive;
 * a missing step means 1.
 */
public final class ForRange extends Node {

    private final String target;
    private final Node start;
    private final Node stop;
    private final Node step;
    private final Block body;

    public ForRange(String target, Node start, Node stop, Node step, Block body, SourceLocation location) {
        super(NodeKind.FOR_RANGE, location, null);
        this.target = Nodes.requireName(target, "range target");
        this.start = Nodes.requireExpression(start, "range start");
        this.stop = Nodes.requireExpression(stop, "range stop");
        this.step = Nodes.optionalExpression(step, "range step");
        this.body = Nodes.requireKind(body, Block.class, "range body");
    }

    public String getTarget() {
        return target;
    }

    public Node getStart() {
        return start;
    }

    public Node getStop() {
        return stop;
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
        children.add(start);
        children.add(stop);
        if (step != null) {
            children.add(step);
        }
        children.add(body);
        return children;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newStart = mapper.apply(start);
        Node newStop = mapper.apply(stop);
        Node newStep = mapOptional(step, mapper);
        Node newBody = mapper.apply(body);
        if (newStart == start && newStop == stop && newStep == step && newBody == body) {
            return this;
        }
        return new ForRange(target, newStart, newStop, newStep,
                Nodes.requireKind(newBody, Block.class, "range body"), getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ForRange)) {
            return false;
        }
        ForRange that = (ForRange) o;
        return target.equals(that.target)
                && start.equals(that.start)
                && stop.equals(that.stop)
                && Objects.equals(step, that.step)
                && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, start, stop, step, body);
    }

    @Override
    public String toString() {
        return "ForRange{target='" + target + "', start=" + start + ", stop=" + stop + ", step=" + step + "}";
    }
}
