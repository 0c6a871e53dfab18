package me.christianrobert.cpp2py.transformation.tree;

import me.christianrobert.cpp2py.transformation.context.StructuralException;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.Break;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;
import me.christianrobert.cpp2py.transformation.tree.statement.If;
import me.christianrobert.cpp2py.transformation.tree.statement.Return;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    // ========== STRUCTURAL EQUALITY ==========

    @Test
    void equalityIgnoresLocationAndInferredType() {
        Node a = new Identifier("x", new SourceLocation(1, 1), "int");
        Node b = new Identifier("x", new SourceLocation(9, 4), null);

        assertEquals(a, b, "Location and type are metadata");
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void equalityComparesChildren() {
        Node sum = new BinaryOp(new Identifier("a"), "+", Literal.integer(1));
        Node same = new BinaryOp(new Identifier("a"), "+", Literal.integer(1));
        Node other = new BinaryOp(new Identifier("a"), "+", Literal.integer(2));

        assertEquals(sum, same);
        assertNotEquals(sum, other);
    }

    @Test
    void equalityComparesOperator() {
        Node plus = new BinaryOp(new Identifier("a"), "+", new Identifier("b"));
        Node minus = new BinaryOp(new Identifier("a"), "-", new Identifier("b"));

        assertNotEquals(plus, minus);
    }

    // ========== MAP CHILDREN ==========

    @Test
    void mapChildrenKeepsInstanceWhenNothingChanges() {
        Node statement = new ExpressionStatement(Call.of("f", new Identifier("x"), Literal.integer(2)));
        Node module = new Module(List.of(statement));

        assertSame(module, module.mapChildren(child -> child), "Identity mapping must return the same instance");
    }

    @Test
    void mapChildrenRebuildsWhenAChildChanges() {
        Identifier x = new Identifier("x");
        Node call = Call.of("f", x);

        Node mapped = call.mapChildren(child -> child == x ? new Identifier("y") : child);

        assertNotSame(call, mapped);
        assertEquals(Call.of("f", new Identifier("y")), mapped);
        assertEquals(Call.of("f", new Identifier("x")), call, "Original node must be untouched");
    }

    @Test
    void mapChildrenValidatesReplacement() {
        Node statement = new ExpressionStatement(new Identifier("x"));

        assertThrows(StructuralException.class,
                () -> statement.mapChildren(child -> new Break(null)),
                "A statement cannot fill an expression slot");
    }

    @Test
    void childrenAreListedInSlotOrder() {
        Literal stop = Literal.integer(10);
        Block body = Block.of(new Break(null));
        ForRange loop = new ForRange("i", Literal.integer(0), stop, null, body, null);

        List<Node> children = loop.getChildren();

        assertEquals(3, children.size(), "Absent step is skipped");
        assertEquals(Literal.integer(0), children.get(0));
        assertSame(stop, children.get(1));
        assertSame(body, children.get(2));
    }

    // ========== SLOT VALIDATION ==========

    @Test
    void assignmentRejectsLiteralTarget() {
        assertThrows(StructuralException.class,
                () -> new Assignment(Literal.integer(1), Literal.integer(2), null));
    }

    @Test
    void assignmentRejectsUnknownOperator() {
        assertThrows(StructuralException.class,
                () -> new Assignment(new Identifier("x"), "**=", Literal.integer(2), null, false, null));
    }

    @Test
    void blockRejectsExpressions() {
        assertThrows(StructuralException.class, () -> Block.of(new Identifier("x")));
    }

    @Test
    void ifRequiresCondition() {
        assertThrows(StructuralException.class, () -> new If(null, Block.of(), null, null));
    }

    @Test
    void functionRequiresName() {
        assertThrows(StructuralException.class,
                () -> new FunctionDef("", List.of(), null, Block.of(), false, null));
    }

    @Test
    void returnValueMustBeExpression() {
        assertThrows(StructuralException.class, () -> new Return(new Break(null), null));
    }

    // ========== TRAVERSAL HELPERS ==========

    @Test
    void descendantsArePreOrder() {
        Node tree = new ExpressionStatement(new BinaryOp(new Identifier("a"), "+", new Identifier("b")));

        List<NodeKind> kinds = Nodes.descendants(tree).map(Node::getKind).collect(Collectors.toList());

        assertEquals(List.of(NodeKind.EXPRESSION_STATEMENT, NodeKind.BINARY_OP, NodeKind.IDENTIFIER,
                NodeKind.IDENTIFIER), kinds);
    }

    @Test
    void transformUpRewritesBottomUp() {
        Node tree = new BinaryOp(new Identifier("a"), "+", new Identifier("a"));

        Node result = Nodes.transformUp(tree,
                n -> n instanceof Identifier ? new Identifier("b") : n);

        assertEquals(new BinaryOp(new Identifier("b"), "+", new Identifier("b")), result);
    }

    @Test
    void transformUpKeepsUntouchedTree() {
        Node tree = new Module(List.of(new ExpressionStatement(Call.of("f"))));

        assertSame(tree, Nodes.transformUp(tree, n -> n));
    }

    @Test
    void referencesNameFindsNestedIdentifier() {
        Node expression = new BinaryOp(Call.of("len", new Identifier("v")), "-", Literal.integer(1));

        assertTrue(Nodes.referencesName(expression, "v"));
        assertFalse(Nodes.referencesName(expression, "w"));
    }

    @Test
    void literalHelpers() {
        assertEquals(Long.valueOf(42), Literal.integer(42).asDecimalInteger());
        assertTrue(Literal.integer(0).isInteger(0));
        assertNull(Literal.string("42").asDecimalInteger(), "Strings are not integers");
        assertEquals("True", Literal.bool(true).getValue());
        assertEquals("None", Literal.none().getValue());
    }
}
