package me.christianrobert.cpp2py.transformation.codegen;

import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.definition.Parameter;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Call;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.TupleLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import me.christianrobert.cpp2py.transformation.tree.statement.Break;
import me.christianrobert.cpp2py.transformation.tree.statement.Continue;
import me.christianrobert.cpp2py.transformation.tree.statement.DoWhileLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.ForRange;
import me.christianrobert.cpp2py.transformation.tree.statement.If;
import me.christianrobert.cpp2py.transformation.tree.statement.Opaque;
import me.christianrobert.cpp2py.transformation.tree.statement.Return;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for statement layout, blank lines, imports and fallbacks for unrewritten loops.
 */
class PythonCodeGeneratorTest {

    private PythonCodeGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new PythonCodeGenerator();
    }

    private String generate(Node... statements) {
        return generator.generate(new Module(List.of(statements)));
    }

    private static Node call(String function, Node... arguments) {
        return new ExpressionStatement(Call.of(function, arguments));
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static FunctionDef function(String name, Node... body) {
        return new FunctionDef(name, List.of(), null, Block.of(body), false, null);
    }

    // ========== MODULE LAYOUT ==========

    @Test
    void emptyModuleRendersAsEmptyString() {
        assertEquals("", generator.generate(new Module(List.of())));
    }

    @Test
    void definitionsAreSeparatedByTwoBlankLines() {
        String python = generate(
                new Assignment(id("x"), Literal.integer(1), null),
                function("f"),
                function("g"),
                call("g"));

        assertEquals("x = 1\n\n\ndef f():\n    pass\n\n\ndef g():\n    pass\n\n\ng()\n", python);
    }

    @Test
    void annotatedDeclaration() {
        String python = generate(new Assignment(id("x"), "=", Literal.integer(1), "int", true, null));

        assertEquals("x: int = 1\n", python);
    }

    @Test
    void augmentedAssignmentAndTupleAssignment() {
        String python = generate(
                new Assignment(id("x"), "+=", Literal.integer(2), null, false, null),
                new Assignment(new TupleLiteral(List.of(id("a"), id("b"))), new TupleLiteral(List.of(id("b"), id("a"))),
                        null));

        assertEquals("x += 2\na, b = b, a\n", python);
    }

    // ========== IMPORTS ==========

    @Test
    void mathImportIsAddedWhenReferenced() {
        Node sqrt = new ExpressionStatement(new Call(new MemberAccess(id("math"), "sqrt"), List.of(id("x"))));

        assertEquals("import math\n\nmath.sqrt(x)\n", generate(sqrt));
    }

    @Test
    void importsAreSortedAndFollowedByTwoBlankLinesBeforeDefinitions() {
        Node stderr = new ExpressionStatement(new MemberAccess(id("sys"), "stderr"));
        Node pi = new Return(new MemberAccess(id("math"), "pi"), null);

        String python = generate(function("f", stderr, pi));

        assertTrue(python.startsWith("import math\nimport sys\n\n\ndef f():\n"), python);
    }

    @Test
    void unrelatedAttributesDoNotImport() {
        Node append = new ExpressionStatement(new Call(new MemberAccess(id("v"), "append"), List.of(id("x"))));

        assertEquals("v.append(x)\n", generate(append));
    }

    // ========== CONTROL FLOW ==========

    @Test
    void elseIfChainsBecomeElif() {
        Node chain = new If(id("a"), Block.of(call("f")),
                Block.of(new If(id("b"), Block.of(call("g")), Block.of(call("h")), null)), null);

        assertEquals("if a:\n    f()\nelif b:\n    g()\nelse:\n    h()\n", generate(chain));
    }

    @Test
    void emptyBranchGetsPass() {
        Node empty = new If(id("a"), Block.of(), null, null);

        assertEquals("if a:\n    pass\n", generate(empty));
    }

    @Test
    void rangeLoopOmitsDefaultStart() {
        Node loop = new ForRange("i", Literal.integer(0), id("n"), null, Block.of(new Break(null)), null);

        assertEquals("for i in range(n):\n    break\n", generate(loop));
    }

    @Test
    void rangeLoopWithStartAndStep() {
        Node from = new ForRange("i", Literal.integer(1), id("n"), null, Block.of(call("f", id("i"))), null);
        Node down = new ForRange("i", Literal.integer(10), Literal.integer(0),
                new Literal(LiteralType.INTEGER, "-1", null, "int"), Block.of(call("f", id("i"))), null);

        assertEquals("for i in range(1, n):\n    f(i)\n", generate(from));
        assertEquals("for i in range(10, 0, -1):\n    f(i)\n", generate(down));
    }

    @Test
    void forEachLoop() {
        Node loop = new ForEach("x", id("v"), Block.of(call("print", id("x"))), null);

        assertEquals("for x in v:\n    print(x)\n", generate(loop));
    }

    @Test
    void cStyleLoopFallsBackToWhileAndRunsStepBeforeContinue() {
        Node step = new ExpressionStatement(new UnaryOp("++", id("i"), true, null, "int"));
        Node skipTwo = new If(new BinaryOp(id("i"), "==", Literal.integer(2)), Block.of(new Continue(null)), null, null);
        Node loop = new ForLoop(
                new Assignment(id("i"), Literal.integer(0), null),
                new BinaryOp(id("i"), "<", id("n")),
                step,
                Block.of(skipTwo, call("print", id("i"))),
                null);

        String expected = "# C-style for loop translated as a while loop\n"
                + "i = 0\n"
                + "while i < n:\n"
                + "    if i == 2:\n"
                + "        i += 1\n"
                + "        continue\n"
                + "    print(i)\n"
                + "    i += 1\n";
        assertEquals(expected, generate(loop));
    }

    @Test
    void continueInNestedNativeLoopHasNoPrelude() {
        Node inner = new ForEach("x", id("v"), Block.of(new Continue(null)), null);
        Node loop = new ForLoop(null, null, new ExpressionStatement(new UnaryOp("++", id("i"), true, null, "int")),
                Block.of(inner), null);

        String expected = "# C-style for loop translated as a while loop\n"
                + "while True:\n"
                + "    for x in v:\n"
                + "        continue\n"
                + "    i += 1\n";
        assertEquals(expected, generate(loop));
    }

    @Test
    void doWhileRunsBodyFirst() {
        Node loop = new DoWhileLoop(
                Block.of(new ExpressionStatement(new UnaryOp("--", id("x"), true, null, "int"))),
                new BinaryOp(id("x"), ">", Literal.integer(0)),
                null);

        assertEquals("while True:\n    x -= 1\n    if not x > 0:\n        break\n", generate(loop));
    }

    // ========== FUNCTIONS AND CLASSES ==========

    @Test
    void parametersWithHintsAndDefaults() {
        FunctionDef f = new FunctionDef("f",
                List.of(new Parameter("x", "int"),
                        new Parameter("y", "int", Literal.integer(2), null),
                        new Parameter("z", null, Literal.integer(2), null)),
                "int",
                Block.of(new Return(id("x"), null)),
                false, null);

        assertEquals("def f(x: int, y: int = 2, z=2) -> int:\n    return x\n", generate(f));
    }

    @Test
    void emptyClassGetsPass() {
        assertEquals("class Empty:\n    pass\n", generate(new ClassDef("Empty", List.of(), List.of(), null)));
    }

    @Test
    void classWithBaseFieldsAndMethods() {
        FunctionDef helper = new FunctionDef("helper", List.of(), "int",
                Block.of(new Return(Literal.integer(1), null)), true, null);
        FunctionDef size = new FunctionDef("size", List.of(new Parameter("self", null)), "int",
                Block.of(new Return(new MemberAccess(id("self"), "count"), null)), false, null);
        Node field = new Assignment(id("count"), "=", Literal.integer(0), "int", true, null);

        String python = generate(new ClassDef("Derived", List.of("Base"), List.of(field, helper, size), null));

        String expected = "class Derived(Base):\n"
                + "    count: int = 0\n"
                + "\n"
                + "    @staticmethod\n"
                + "    def helper() -> int:\n"
                + "        return 1\n"
                + "\n"
                + "    def size(self) -> int:\n"
                + "        return self.count\n";
        assertEquals(expected, python);
    }

    @Test
    void keywordNamesAreEscaped() {
        assertEquals("def lambda_():\n    pass\n", generate(function("lambda")));
    }

    // ========== OPAQUE ==========

    @Test
    void opaqueIsCommentedOutWithLocationAndReason() {
        Node opaque = new Opaque("switch (x) {\n    case 1: break;\n}", "switch statement", new SourceLocation(3, 5));

        String expected = "# UNTRANSLATED C++ (line 3, column 5): switch statement\n"
                + "# switch (x) {\n"
                + "#     case 1: break;\n"
                + "# }\n";
        assertEquals(expected, generate(opaque));
    }

    @Test
    void bodyOfOnlyOpaqueStillGetsPass() {
        Node opaque = new Opaque("throw 1;", "throw", new SourceLocation(2, 5));

        String expected = "def f():\n"
                + "    # UNTRANSLATED C++ (line 2, column 5): throw\n"
                + "    # throw 1;\n"
                + "    pass\n";
        assertEquals(expected, generate(function("f", opaque)));
    }
}
