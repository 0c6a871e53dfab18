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
 * Conditional with an optional else block. An else block holding a single {@code If}
 * renders as {@code elif}.
 */
public final class If extends Node {

    private final Node condition;
    private final Block thenBlock;
    private final Block elseBlock;

    public If(Node condition, Block thenBlock, Block elseBlock, SourceLocation location) {
        super(NodeKind.IF, location, null);
        this.condition = Nodes.requireExpression(condition, "if condition");
        this.thenBlock = Nodes.requireKind(thenBlock, Block.class, "if branch");
        this.elseBlock = elseBlock == null ? null : Nodes.requireKind(elseBlock, Block.class, "else branch");
    }

    public Node getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    @Override
    public List<Node> getChildren() {
        List<Node> children = new ArrayList<>(3);
        children.add(condition);
        children.add(thenBlock);
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        return children;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        Node newCondition = mapper.apply(condition);
        Node newThen = mapper.apply(thenBlock);
        Node newElse = mapOptional(elseBlock, mapper);
        if (newCondition == condition && newThen == thenBlock && newElse == elseBlock) {
            return this;
        }
        return new If(newCondition,
                Nodes.requireKind(newThen, Block.class, "if branch"),
                newElse == null ? null : Nodes.requireKind(newElse, Block.class, "else branch"),
                getLocation());
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof If)) {
            return false;
        }
        If that = (If) o;
        return condition.equals(that.condition)
                && thenBlock.equals(that.thenBlock)
                && Objects.equals(elseBlock, that.elseBlock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(NodeKind.IF, condition, thenBlock, elseBlock);
    }

    @Override
    public String toString() {
        return "If{condition=" + condition + ", hasElse=" + (elseBlock != null) + "}";
    }
}
