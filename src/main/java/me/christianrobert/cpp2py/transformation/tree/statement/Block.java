package me.christianrobert.cpp2py.transformation.tree.statement;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.NodeKind;
import me.christianrobert.cpp2py.transformation.tree.Nodes;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered statement sequence forming an indented suite.
 */
public final class Block extends Node {

    private final List<Node> statements;

    public Block(List<? extends Node> statements) {
        super(NodeKind.BLOCK, null, null);
        this.statements = Nodes.requireStatements(statements, "block statement");
    }

    public static Block of(Node... statements) {
        return new Block(List.of(statements));
    }

    public List<Node> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public List<Node> getChildren() {
        return statements;
    }

    @Override
    public Node mapChildren(UnaryOperator<Node> mapper) {
        List<Node> newStatements = mapList(statements, mapper);
        if (newStatements == statements) {
            return this;
        }
        return new Block(newStatements);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Block && statements.equals(((Block) o).statements);
    }

    @Override
    public int hashCode() {
        return statements.hashCode();
    }

    @Override
    public String toString() {
        return "Block{statements=" + statements.size() + "}";
    }
}
