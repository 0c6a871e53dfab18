package me.christianrobert.cpp2py.transformation.service;

import me.christianrobert.cpp2py.transformation.builder.ConversionResult;
import me.christianrobert.cpp2py.transformation.builder.TreeConverter;
import me.christianrobert.cpp2py.transformation.codegen.PythonCodeGenerator;
import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.context.DiagnosticKind;
import me.christianrobert.cpp2py.transformation.context.FailureKind;
import me.christianrobert.cpp2py.transformation.context.TranslationResult;
import me.christianrobert.cpp2py.transformation.engine.RewriteEngine;
import me.christianrobert.cpp2py.transformation.engine.RewriteOptions;
import me.christianrobert.cpp2py.transformation.engine.RewriteResult;
import me.christianrobert.cpp2py.transformation.parser.AntlrParser;
import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.rule.RuleRegistry;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;
import me.christianrobert.cpp2py.transformation.tree.Node;
import me.christianrobert.cpp2py.transformation.tree.SourceLocation;
import me.christianrobert.cpp2py.transformation.tree.expression.Identifier;
import me.christianrobert.cpp2py.transformation.tree.statement.Block;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the translation pipeline: C++ → parse → convert → rewrite → Python.
 *
 * <p>Creates the service manually instead of through CDI.</p>
 */
class TranslationServiceTest {

    private TranslationService translationService;

    @BeforeEach
    void setUp() {
        translationService = new TranslationService();
        translationService.parser = new AntlrParser();
        translationService.engine = new RewriteEngine();
        translationService.generator = new PythonCodeGenerator();
    }

    private static Rule rule(String name, UnaryOperator<Node> body) {
        return new Rule() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Node apply(Node node) {
                return body.apply(node);
            }
        };
    }

    // ========== SUCCESS CASES ==========

    @Test
    void countingLoopWithOutput() {
        String cpp = "int main(){ int i; for (i = 0; i < 5; i = i + 1) { std::cout << i << std::endl; } return 0; }";
        String expected = "def main() -> int:\n"
                + "    i: int = None\n"
                + "    for i in range(5):\n"
                + "        print(i)\n"
                + "    return 0\n"
                + "\n"
                + "\n"
                + "if __name__ == \"__main__\":\n"
                + "    main()\n";

        TranslationResult result = translationService.convert(cpp);

        assertTrue(result.isSuccess(), () -> "Translation should succeed: " + result.getErrorMessage());
        assertEquals(expected, result.getPythonCode());
        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals(cpp, result.getCppSource());
        assertNull(result.getErrorMessage());
    }

    @Test
    void helloWorld() {
        String cpp = "#include <iostream>\n"
                + "using namespace std;\n"
                + "\n"
                + "int main() {\n"
                + "    cout << \"Hello, World!\" << endl;\n"
                + "    return 0;\n"
                + "}\n";
        String expected = "def main() -> int:\n"
                + "    print(\"Hello, World!\")\n"
                + "    return 0\n"
                + "\n"
                + "\n"
                + "if __name__ == \"__main__\":\n"
                + "    main()\n";

        TranslationResult result = translationService.convert(cpp);

        assertEquals(expected, result.getPythonCode());
    }

    @Test
    void vectorParameterAndRangeFor() {
        String cpp = "int sum(const std::vector<int>& values) {\n"
                + "    int total = 0;\n"
                + "    for (int v : values) {\n"
                + "        total += v;\n"
                + "    }\n"
                + "    return total;\n"
                + "}\n";
        String expected = "def sum(values: list[int]) -> int:\n"
                + "    total: int = 0\n"
                + "    for v in values:\n"
                + "        total += v\n"
                + "    return total\n";

        TranslationResult result = translationService.convert(cpp);

        assertEquals(expected, result.getPythonCode());
    }

    @Test
    void onlySelectedRulesApply() {
        String cpp = "int main(){ int i; for (i = 0; i < 5; i = i + 1) { std::cout << i << std::endl; } return 0; }";
        RuleSet loopsOnly = RuleSet.select(RuleRegistry.defaultRegistry(), List.of("for-loop-to-range"));

        TranslationResult result = translationService.convert(cpp, loopsOnly, RewriteOptions.defaults());

        assertTrue(result.isSuccess());
        assertTrue(result.getPythonCode().contains("for i in range(5):"), result.getPythonCode());
        assertTrue(result.getPythonCode().contains("std.cout << i << std.endl"), result.getPythonCode());
        assertFalse(result.getPythonCode().contains("print("), "Output rule was not selected");
        assertFalse(result.getPythonCode().contains("__main__"), "Main guard was not selected");
    }

    @Test
    void emptySourceTranslatesToEmptyOutput() {
        TranslationResult result = translationService.convert("");

        assertTrue(result.isSuccess());
        assertEquals("", result.getPythonCode());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void translationIsDeterministic() {
        String cpp = "int main() {\n"
                + "    int n;\n"
                + "    std::cin >> n;\n"
                + "    switch (n) { default: break; }\n"
                + "    printf(\"%d\\n\", n / 2);\n"
                + "    return 0;\n"
                + "}\n";

        TranslationResult first = translationService.convert(cpp);
        TranslationResult second = translationService.convert(cpp);

        assertEquals(first.getPythonCode(), second.getPythonCode());
        assertEquals(first.getDiagnostics(), second.getDiagnostics());
    }

    @Test
    void treeIsAttachedOnRequest() {
        String cpp = "int main() { for (int i = 0; i < 3; i++) { } return 0; }";

        TranslationResult result = translationService.convert(cpp, RuleSet.all(RuleRegistry.defaultRegistry()),
                RewriteOptions.defaults(), true);

        assertTrue(result.hasTree());
        assertTrue(result.getTree().startsWith("MODULE"), result.getTree());
        assertTrue(result.getTree().contains("FOR_RANGE"), result.getTree());
        assertFalse(translationService.convert(cpp).hasTree());
    }

    @Test
    void memberCallStatementsTranslateCleanly() {
        String cpp = "class Bag {\n"
                + "public:\n"
                + "    std::vector<int> items;\n"
                + "    void add(int x) { items.push_back(x); }\n"
                + "};\n"
                + "\n"
                + "int main() {\n"
                + "    std::vector<int> v;\n"
                + "    v.push_back(1);\n"
                + "    Bag a;\n"
                + "    Bag b;\n"
                + "    a.add(1);\n"
                + "    std::cout << b.items.size() << std::endl;\n"
                + "    return 0;\n"
                + "}\n";

        TranslationResult result = translationService.convert(cpp);

        assertTrue(result.isSuccess(), () -> "Translation should succeed: " + result.getErrorMessage());
        assertTrue(result.getDiagnostics().isEmpty(), () -> "Unexpected diagnostics: " + result.getDiagnostics());
        String python = result.getPythonCode();
        assertTrue(python.startsWith("class Bag:\n"
                + "    def __init__(self):\n"
                + "        self.items: list[int] = []\n"
                + "\n"
                + "    def add(self, x: int):\n"
                + "        self.items.append(x)\n"), python);
        assertTrue(python.contains("    v.append(1)\n"), python);
        assertTrue(python.contains("    a.add(1)\n"), python);
        assertTrue(python.contains("    print(len(b.items))\n"), python);
        assertFalse(python.contains("\n    items:"), "Instance fields are not class attributes");
    }

    @Test
    void rewritingTheRewrittenTreeChangesNothing() {
        String cpp = "class Bag {\n"
                + "public:\n"
                + "    std::vector<int> items;\n"
                + "    void add(int x) { items.push_back(x); }\n"
                + "    int count() const { return items.size(); }\n"
                + "};\n"
                + "\n"
                + "int main() {\n"
                + "    int n;\n"
                + "    std::cin >> n;\n"
                + "    Bag bag;\n"
                + "    for (int i = 0; i < n; i++) {\n"
                + "        bag.add(i / 2);\n"
                + "    }\n"
                + "    double ratio = (double) n;\n"
                + "    printf(\"%d\\n\", bag.count());\n"
                + "    std::cout << std::max(n, 3) << \" \" << std::to_string(ratio) << std::endl;\n"
                + "    return 0;\n"
                + "}\n";
        ConversionResult conversion = TreeConverter.convert(translationService.parser.parse(cpp).getTree());
        RuleSet everyRule = RuleSet.all(RuleRegistry.defaultRegistry());

        RewriteResult once = translationService.engine.rewrite(conversion.getModule(), everyRule,
                RewriteOptions.defaults());
        RewriteResult twice = translationService.engine.rewrite(once.getTree(), everyRule, RewriteOptions.defaults());

        assertTrue(once.getChanges() > 0);
        assertTrue(once.getDiagnostics().isEmpty(), () -> "Unexpected diagnostics: " + once.getDiagnostics());
        assertEquals(0, twice.getChanges(), "Every rule is done after one pass");
        assertEquals(once.getTree(), twice.getTree());
    }

    // ========== DIAGNOSTICS ==========

    @Test
    void multipleInheritanceIsPassedThroughWithOneDiagnostic() {
        String cpp = "class C : public A, public B {\npublic:\n    int x;\n};";

        TranslationResult result = translationService.convert(cpp);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.UNSUPPORTED_CONSTRUCT, diagnostic.getKind());
        assertEquals(new SourceLocation(1, 9), diagnostic.getLocation());
        String expected = "# UNTRANSLATED C++ (line 1, column 9): multiple inheritance\n"
                + "# class C : public A, public B {\n"
                + "# public:\n"
                + "#     int x;\n"
                + "# };\n";
        assertEquals(expected, result.getPythonCode());
    }

    @Test
    void unsupportedStatementKeepsRestOfProgram() {
        String cpp = "int main() {\n"
                + "    int x = 1;\n"
                + "    switch (x) { default: break; }\n"
                + "    return x;\n"
                + "}\n";

        TranslationResult result = translationService.convert(cpp);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getDiagnostics().size());
        String python = result.getPythonCode();
        assertTrue(python.contains("    # UNTRANSLATED C++ (line 3, column 5): switch statement\n"), python);
        assertTrue(python.contains("    return x\n"), python);
        assertTrue(python.contains("if __name__ == \"__main__\":"), python);
    }

    @Test
    void failingRuleIsReportedButTranslationSucceeds() {
        Rule failing = rule("boom", node -> {
            if (node instanceof Identifier) {
                throw new IllegalStateException("kaboom");
            }
            return node;
        });

        TranslationResult result = translationService.convert("int f() { return x; }", RuleSet.of(failing),
                RewriteOptions.defaults());

        assertTrue(result.isSuccess());
        assertEquals("def f() -> int:\n    return x\n", result.getPythonCode());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.RULE_FAILURE, result.getDiagnostics().get(0).getKind());
    }

    // ========== FAILURE CASES ==========

    @Test
    void syntaxErrorFailsWithParseError() {
        TranslationResult result = translationService.convert("int main() { return 0 }");

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.PARSE_ERROR, result.getFailureKind());
        assertTrue(result.getErrorMessage().startsWith("Parse errors: Line 1:"), result.getErrorMessage());
        assertNull(result.getPythonCode());
    }

    @Test
    void nullSourceFails() {
        TranslationResult result = translationService.convert(null);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.INTERNAL_ERROR, result.getFailureKind());
        assertEquals("C++ source cannot be null", result.getErrorMessage());
    }

    @Test
    void strictModeTurnsRuleFailureIntoError() {
        Rule failing = rule("boom", node -> {
            if (node instanceof Identifier) {
                throw new IllegalStateException("kaboom");
            }
            return node;
        });

        TranslationResult result = translationService.convert("int f() { return x; }", RuleSet.of(failing),
                RewriteOptions.defaults().withStrict(true));

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.RULE_FAILURE, result.getFailureKind());
        assertTrue(result.getErrorMessage().startsWith("Rule boom failed"), result.getErrorMessage());
    }

    @Test
    void strictFixedPointReportsNonConvergence() {
        Rule flip = rule("flip", node -> {
            if (node instanceof Identifier && "x".equals(((Identifier) node).getName())) {
                return new Identifier("y");
            }
            if (node instanceof Identifier && "y".equals(((Identifier) node).getName())) {
                return new Identifier("x");
            }
            return node;
        });
        RewriteOptions options = new RewriteOptions(true, 5, true);

        TranslationResult result = translationService.convert("int f() { return x; }", RuleSet.of(flip), options);

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.NON_CONVERGENCE, result.getFailureKind());
    }

    @Test
    void lenientFixedPointKeepsLastTree() {
        Rule flip = rule("flip", node -> {
            if (node instanceof Identifier && "x".equals(((Identifier) node).getName())) {
                return new Identifier("y");
            }
            if (node instanceof Identifier && "y".equals(((Identifier) node).getName())) {
                return new Identifier("x");
            }
            return node;
        });
        RewriteOptions options = new RewriteOptions(true, 3, false);

        TranslationResult result = translationService.convert("int f() { return x; }", RuleSet.of(flip), options);

        assertTrue(result.isSuccess());
        assertEquals("def f() -> int:\n    return y\n", result.getPythonCode());
        assertEquals(List.of(Diagnostic.nonConvergence(3)), result.getDiagnostics());
    }

    @Test
    void malformedRewriteIsAStructuralError() {
        Rule malformed = rule("malformed", node -> node instanceof Identifier ? Block.of(node) : node);

        TranslationResult result = translationService.convert("int f() { return x; }", RuleSet.of(malformed),
                RewriteOptions.defaults());

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.STRUCTURAL_ERROR, result.getFailureKind());
    }
}
