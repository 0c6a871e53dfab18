package me.christianrobert.cpp2py.transformation.tree;

import me.christianrobert.cpp2py.transformation.context.StructuralException;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Static helpers for validating slots and walking trees.
 */
public final class Nodes {

    private Nodes() {
    }

    // ========== SLOT VALIDATION ==========

    public static Node requireStatement(Node node, String slot) {
        requirePresent(node, slot);
        if (!node.getKind().isStatement()) {
            throw new StructuralException(slot + " must be a statement but was " + node.getKind());
        }
        return node;
    }

    public static Node requireExpression(Node node, String slot) {
        requirePresent(node, slot);
        if (!node.getKind().isExpression()) {
            throw new StructuralException(slot + " must be an expression but was " + node.getKind());
        }
        return node;
    }

    /**
     * Optional expression slot: null is accepted.
     */
    public static Node optionalExpression(Node node, String slot) {
        return node == null ? null : requireExpression(node, slot);
    }

    public static <T extends Node> T requireKind(Node node, Class<T> type, String slot) {
        requirePresent(node, slot);
        if (!type.isInstance(node)) {
            throw new StructuralException(slot + " must be " + type.getSimpleName() + " but was " + node.getKind());
        }
        return type.cast(node);
    }

    public static List<Node> requireStatements(List<? extends Node> nodes, String slot) {
        if (nodes == null) {
            throw new StructuralException(slot + " list cannot be null");
        }
        for (Node node : nodes) {
            requireStatement(node, slot);
        }
        return List.copyOf(nodes);
    }

    public static List<Node> requireExpressions(List<? extends Node> nodes, String slot) {
        if (nodes == null) {
            throw new StructuralException(slot + " list cannot be null");
        }
        for (Node node : nodes) {
            requireExpression(node, slot);
        }
        return List.copyOf(nodes);
    }

    public static <T extends Node> List<T> requireAll(List<? extends Node> nodes, Class<T> type, String slot) {
        if (nodes == null) {
            throw new StructuralException(slot + " list cannot be null");
        }
        List<T> result = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            result.add(requireKind(node, type, slot));
        }
        return List.copyOf(result);
    }

    public static String requireName(String name, String slot) {
        if (name == null || name.isEmpty()) {
            throw new StructuralException(slot + " cannot be empty");
        }
        return name;
    }

    private static void requirePresent(Node node, String slot) {
        if (node == null) {
            throw new StructuralException(slot + " is required");
        }
    }

    // ========== TRAVERSAL ==========

    /**
     * Pre-order stream of the node and all its descendants.
     */
    public static Stream<Node> descendants(Node root) {
        return Stream.concat(Stream.of(root), root.getChildren().stream().flatMap(Nodes::descendants));
    }

    /**
     * Rebuilds the tree bottom-up: children are transformed before their parent is
     * handed to {@code fn}. Untouched subtrees keep their instances.
     */
    public static Node transformUp(Node root, UnaryOperator<Node> fn) {
        Node rebuilt = root.mapChildren(child -> transformUp(child, fn));
        return fn.apply(rebuilt);
    }

    /**
     * True when some descendant (or the node itself) is an identifier with the given name.
     */
    public static boolean referencesName(Node root, String name) {
        return descendants(root).anyMatch(n -> n instanceof Identifier && ((Identifier) n).getName().equals(name));
    }
}
