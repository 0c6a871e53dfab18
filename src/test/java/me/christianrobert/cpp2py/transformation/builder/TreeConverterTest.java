package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.context.DiagnosticKind;
import me.christianrobert.cpp2py.transformation.parser.AntlrParser;
import me.christianrobert.cpp2py.transformation.parser.ParseResult;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.definition.ClassDef;
import me.christianrobert.cpp2py.transformation.tree.definition.FunctionDef;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.tree.expression.BinaryOp;
import me.christianrobert.cpp2py.transformation.tree.expression.Cast;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.expression.ListLiteral;
import me.christianrobert.cpp2py.transformation.tree.expression.Literal;
import me.christianrobert.cpp2py.transformation.tree.expression.LiteralType;
import me.christianrobert.cpp2py.transformation.tree.expression.MemberAccess;
import me.christianrobert.cpp2py.transformation.tree.expression.UnaryOp;
import me.christianrobert.cpp2py.transformation.tree.statement.Assignment;
import me.christianrobert.cpp2py.transformation.tree.statement.ExpressionStatement;
import me.christianrobert.cpp2py.transformation.tree.statement.ForEach;
import me.christianrobert.cpp2py.transformation.tree.statement.ForLoop;
import me.christianrobert.cpp2py.transformation.tree.statement.Opaque;
import me.christianrobert.cpp2py.transformation.tree.statement.Return;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lowering the ANTLR parse tree into the internal tree.
 */
class TreeConverterTest {

    private AntlrParser parser;

    @BeforeEach
    void setUp() {
        parser = new AntlrParser();
    }

    private ConversionResult convert(String cpp) {
        ParseResult parseResult = parser.parse(cpp);
        assertTrue(parseResult.isSuccess(), () -> "Parsing should succeed: " + parseResult.getErrorMessage());
        return TreeConverter.convert(parseResult.getTree());
    }

    private List<Node> mainBody(String statements) {
        ConversionResult result = convert("int main() {\n" + statements + "\n}\n");
        FunctionDef main = (FunctionDef) result.getModule().getBody().get(0);
        return main.getBody().getStatements();
    }

    // ========== MODULE ==========

    @Test
    void emptyTranslationUnitGivesEmptyModule() {
        ConversionResult result = convert("");

        assertTrue(result.getModule().isEmpty());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void usingDirectivesAndPrototypesProduceNothing() {
        ConversionResult result = convert("using namespace std;\nint helper(int x);\nclass Later;\n");

        assertTrue(result.getModule().isEmpty());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    // ========== DECLARATIONS ==========

    @Test
    void multipleDeclaratorsBecomeSeparateAssignments() {
        List<Node> body = mainBody("int a = 1, b = 2;");

        assertEquals(2, body.size());
        Assignment a = (Assignment) body.get(0);
        Assignment b = (Assignment) body.get(1);
        assertTrue(a.isDeclaration());
        assertEquals("int", a.getTypeHint());
        assertEquals(new Identifier("a"), a.getTarget());
        assertEquals(Literal.integer(1), a.getValue());
        assertEquals(new Identifier("b"), b.getTarget());
    }

    @Test
    void uninitializedScalarStartsAsNone() {
        Assignment x = (Assignment) mainBody("int x;").get(0);

        assertEquals(Literal.none(), x.getValue());
    }

    @Test
    void uninitializedStringAndVectorGetEmptyValues() {
        List<Node> body = mainBody("std::string s;\nstd::vector<int> v;");

        Assignment s = (Assignment) body.get(0);
        Assignment v = (Assignment) body.get(1);
        assertEquals("str", s.getTypeHint());
        assertEquals(Literal.string(""), s.getValue());
        assertEquals("list[int]", v.getTypeHint());
        assertEquals(new ListLiteral(List.of()), v.getValue());
        assertEquals("std::vector<int>", v.getTarget().getInferredType());
    }

    @Test
    void fixedSizeArrayIsFilledWithZeros() {
        Assignment arr = (Assignment) mainBody("int arr[3];").get(0);

        assertEquals("list[int]", arr.getTypeHint());
        assertEquals(new BinaryOp(new ListLiteral(List.of(Literal.integer(0))), "*", Literal.integer(3)),
                arr.getValue());
    }

    @Test
    void partiallyInitializedArrayIsPadded() {
        Assignment arr = (Assignment) mainBody("int a[5] = {1, 2};").get(0);

        Node expected = new BinaryOp(
                new ListLiteral(List.of(Literal.integer(1), Literal.integer(2))),
                "+",
                new BinaryOp(new ListLiteral(List.of(Literal.integer(0))), "*", Literal.integer(3)));
        assertEquals(expected, arr.getValue());
    }

    @Test
    void autoTakesTypeOfInitializer() {
        List<Node> body = mainBody("double d = 1.5;\nint n = 2;\nauto product = d * n;");

        Assignment product = (Assignment) body.get(2);
        assertEquals("float", product.getTypeHint());
        assertEquals("double", product.getValue().getInferredType());
    }

    @Test
    void pointerDeclarationHasNoAnnotation() {
        Assignment p = (Assignment) mainBody("int* p = nullptr;").get(0);

        assertNull(p.getTypeHint());
        assertEquals(Literal.none(), p.getValue());
    }

    // ========== LITERALS AND OPERATORS ==========

    @Test
    void literalsAreRespelledForPython() {
        List<Node> body = mainBody("int o = 017;\nint u = 10u;\nchar c = 'a';\nbool t = true;\ndouble f = .5f;");

        assertEquals("0o17", ((Literal) ((Assignment) body.get(0)).getValue()).getValue());
        assertEquals("10", ((Literal) ((Assignment) body.get(1)).getValue()).getValue());
        Literal c = (Literal) ((Assignment) body.get(2)).getValue();
        assertEquals(LiteralType.STRING, c.getType());
        assertEquals("a", c.getValue());
        assertEquals("char", c.getInferredType());
        assertEquals("True", ((Literal) ((Assignment) body.get(3)).getValue()).getValue());
        assertEquals("0.5", ((Literal) ((Assignment) body.get(4)).getValue()).getValue());
    }

    @Test
    void adjacentStringLiteralsAreConcatenated() {
        Assignment s = (Assignment) mainBody("std::string s = \"ab\" \"cd\";").get(0);

        assertEquals(Literal.string("abcd"), s.getValue());
    }

    @Test
    void logicalOperatorsBecomeWords() {
        List<Node> body = mainBody("bool a = true;\nbool b = false;\nbool c = !a && b || a;");

        Node value = ((Assignment) body.get(2)).getValue();
        Node expected = new BinaryOp(
                new BinaryOp(new UnaryOp("not", new Identifier("a"), false, null, "bool"), "and", new Identifier("b")),
                "or",
                new Identifier("a"));
        assertEquals(expected, value);
    }

    @Test
    void integerArithmeticIsTypedInt() {
        List<Node> body = mainBody("int a = 7;\nint b = 2;\nint q = a / b;");

        BinaryOp division = (BinaryOp) ((Assignment) body.get(2)).getValue();
        assertEquals("/", division.getOperator());
        assertEquals("int", division.getInferredType());
    }

    @Test
    void castsAreKeptAsCastNodes() {
        List<Node> body = mainBody("int n = 3;\ndouble d = (double) n;\nint m = static_cast<int>(d);");

        Cast cStyle = (Cast) ((Assignment) body.get(1)).getValue();
        Cast named = (Cast) ((Assignment) body.get(2)).getValue();
        assertEquals("double", cStyle.getTargetType());
        assertEquals(new Identifier("n"), cStyle.getOperand());
        assertEquals("int", named.getTargetType());
    }

    @Test
    void integerCompoundDivisionIsExpanded() {
        List<Node> body = mainBody("int a = 9;\na /= 2;");

        Assignment assignment = (Assignment) body.get(1);
        assertEquals("=", assignment.getOperator());
        assertEquals(new BinaryOp(new Identifier("a"), "/", Literal.integer(2)), assignment.getValue());
    }

    // ========== STATEMENTS ==========

    @Test
    void forLoopKeepsItsSlots() {
        List<Node> body = mainBody("int n = 3;\nfor (int i = 0; i < n; i++) {\n}");

        ForLoop loop = (ForLoop) body.get(1);
        assertTrue(loop.getInit() instanceof Assignment);
        assertTrue(((Assignment) loop.getInit()).isDeclaration());
        assertEquals(new BinaryOp(new Identifier("i"), "<", new Identifier("n")), loop.getCondition());
        ExpressionStatement step = (ExpressionStatement) loop.getStep();
        UnaryOp increment = (UnaryOp) step.getExpression();
        assertEquals("++", increment.getOperator());
        assertTrue(increment.isPostfix());
        assertTrue(loop.getBody().isEmpty());
    }

    @Test
    void rangeForBecomesForEach() {
        List<Node> body = mainBody("std::vector<int> v = {1, 2};\nfor (int x : v) {\n}");

        ForEach loop = (ForEach) body.get(1);
        assertEquals("x", loop.getTarget());
        assertEquals(new Identifier("v"), loop.getIterable());
    }

    @Test
    void standaloneMemberIncrementIsSupported() {
        List<Node> body = mainBody("p.count++;");

        ExpressionStatement statement = (ExpressionStatement) body.get(0);
        UnaryOp increment = (UnaryOp) statement.getExpression();
        assertEquals(new MemberAccess(new Identifier("p"), "count"), increment.getOperand());
    }

    @Test
    void compoundStatementsAreFlattened() {
        List<Node> body = mainBody("{\n    int a = 1;\n    {\n        int b = 2;\n    }\n}\nreturn 0;");

        assertEquals(3, body.size());
        assertTrue(body.get(2) instanceof Return);
    }

    // ========== CLASSES ==========

    @Test
    void classBecomesClassDefWithConstructorAndFields() {
        String cpp = "class Point {\n"
                + "public:\n"
                + "    Point(int x, int y) : x(x), y(y) {}\n"
                + "    int sum() const { return x + y; }\n"
                + "private:\n"
                + "    int x;\n"
                + "    int y;\n"
                + "};\n";

        ConversionResult result = convert(cpp);

        ClassDef point = (ClassDef) result.getModule().getBody().get(0);
        assertEquals("Point", point.getName());
        assertEquals(2, point.getBody().size(), "Fields set by member initializers need no default");

        FunctionDef constructor = (FunctionDef) point.getBody().get(0);
        assertEquals("Point", constructor.getName());
        assertEquals(2, constructor.getParameters().size());
        Assignment init = (Assignment) constructor.getBody().getStatements().get(0);
        assertEquals(new MemberAccess(new Identifier("this"), "x"), init.getTarget());
        assertEquals(new Identifier("x"), init.getValue());

        FunctionDef sum = (FunctionDef) point.getBody().get(1);
        assertEquals("int", sum.getReturnType());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void destructorBecomesOpaqueMember() {
        String cpp = "class Holder {\n"
                + "public:\n"
                + "    ~Holder() {}\n"
                + "    int value;\n"
                + "};\n";

        ConversionResult result = convert(cpp);

        ClassDef holder = (ClassDef) result.getModule().getBody().get(0);
        assertTrue(holder.getBody().get(0) instanceof Opaque);
        FunctionDef constructor = (FunctionDef) holder.getBody().get(1);
        assertEquals("Holder", constructor.getName(), "Fields get a constructor to live in");
        Assignment field = (Assignment) constructor.getBody().getStatements().get(0);
        assertEquals(new MemberAccess(new Identifier("this"), "value"), field.getTarget());
        assertTrue(field.isDeclaration());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals("destructor", result.getDiagnostics().get(0).getMessage());
    }

    @Test
    void overloadedMethodBecomesOpaque() {
        String cpp = "class Printer {\n"
                + "public:\n"
                + "    void show(int x) {}\n"
                + "    void show(double x) {}\n"
                + "};\n";

        ConversionResult result = convert(cpp);

        ClassDef printer = (ClassDef) result.getModule().getBody().get(0);
        assertTrue(printer.getBody().get(0) instanceof FunctionDef);
        assertTrue(printer.getBody().get(1) instanceof Opaque);
    }

    // ========== FAIL-SOFT ==========

    @Test
    void multipleInheritanceBecomesOpaqueWithOneDiagnostic() {
        String cpp = "class C : public A, public B {\n"
                + "public:\n"
                + "    int x;\n"
                + "};";

        ConversionResult result = convert(cpp);

        Module module = result.getModule();
        assertEquals(1, module.getBody().size());
        Opaque opaque = (Opaque) module.getBody().get(0);
        assertEquals(cpp, opaque.getText(), "Original text is kept verbatim");
        assertEquals("multiple inheritance", opaque.getReason());

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.UNSUPPORTED_CONSTRUCT, diagnostic.getKind());
        assertEquals(new SourceLocation(1, 9), diagnostic.getLocation(), "Points at the base clause");
        assertEquals(diagnostic.getLocation(), opaque.getLocation());
    }

    @Test
    void unsupportedStatementLeavesRestOfFunctionIntact() {
        ConversionResult result = convert("int main() {\n    switch (1) { default: break; }\n    return 0;\n}\n");

        FunctionDef main = (FunctionDef) result.getModule().getBody().get(0);
        List<Node> body = main.getBody().getStatements();
        assertEquals(2, body.size());
        Opaque opaque = (Opaque) body.get(0);
        assertEquals("switch (1) { default: break; }", opaque.getText());
        assertTrue(body.get(1) instanceof Return);

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(new SourceLocation(2, 5), result.getDiagnostics().get(0).getLocation());
    }

    @Test
    void nestedUnsupportedExpressionReportsItsOwnLocation() {
        ConversionResult result = convert("int main() {\n    x = y = 0;\n}\n");

        FunctionDef main = (FunctionDef) result.getModule().getBody().get(0);
        Opaque opaque = (Opaque) main.getBody().getStatements().get(0);
        assertEquals("x = y = 0;", opaque.getText(), "The whole statement is passed through");
        assertEquals("assignment inside an expression", opaque.getReason());
        assertEquals(new SourceLocation(2, 9), result.getDiagnostics().get(0).getLocation());
    }

    @Test
    void templatesAndNamespacesAreOpaque() {
        ConversionResult result = convert("template <typename T> T id(T v) { return v; }\nnamespace util { }\n");

        assertEquals(2, result.getModule().getBody().size());
        assertTrue(result.getModule().getBody().stream().allMatch(n -> n instanceof Opaque));
        assertEquals(2, result.getDiagnostics().size());
        assertEquals("template", result.getDiagnostics().get(0).getMessage());
        assertEquals("namespace", result.getDiagnostics().get(1).getMessage());
    }

    @Test
    void expressionIncrementOfMemberIsOpaque() {
        List<Node> body = mainBody("int y = p.count++;");

        Opaque opaque = (Opaque) body.get(0);
        assertEquals("increment or decrement of a non-variable", opaque.getReason());
    }

    @Test
    void pointerDereferenceIsOpaque() {
        List<Node> body = mainBody("*p = 1;");

        assertEquals("pointer dereference", ((Opaque) body.get(0)).getReason());
    }

    @Test
    void conversionIsDeterministic() {
        String cpp = "int main() {\n    int a = 1;\n    switch (a) { default: break; }\n    return a;\n}\n";

        ConversionResult first = convert(cpp);
        ConversionResult second = convert(cpp);

        assertEquals(first.getModule(), second.getModule());
        assertEquals(first.getDiagnostics(), second.getDiagnostics());
    }
}
