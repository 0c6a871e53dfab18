package me.christianrobert.cpp2py.transformation.rule.builtin;

import org.junit.jupiter.api.Test;

import static me.christianrobert.cpp2py.transformation.rule.builtin.RuleFixture.body;
import static me.christianrobert.cpp2py.transformation.rule.builtin.RuleFixture.python;
import static org.junit.jupiter.api.Assertions.*;

class StdFunctionCallRuleTest {

    private static final String RULE = StdFunctionCallRule.NAME;

    @Test
    void mathFunctionsImportMath() {
        String python = python("double root(double x) {\n    return std::sqrt(x);\n}\n", RULE);

        assertEquals("import math\n\n\ndef root(x: float) -> float:\n    return math.sqrt(x)\n", python);
    }

    @Test
    void conversions() {
        String python = body("std::string s = \"42\";\nint n = std::stoi(s);\nstd::string t = std::to_string(n);"
                + "\ndouble d = std::stod(s);", RULE);

        assertTrue(python.contains("    n: int = int(s)\n"), python);
        assertTrue(python.contains("    t: str = str(n)\n"), python);
        assertTrue(python.contains("    d: float = float(s)\n"), python);
    }

    @Test
    void builtins() {
        String python = body("int a = 1;\nint b = 2;\nint m = std::max(a, b);\nint k = abs(-3);", RULE);

        assertTrue(python.contains("    m: int = max(a, b)\n"), python);
        assertTrue(python.contains("    k: int = abs(-3)\n"), python);
    }

    @Test
    void unqualifiedMathFunction() {
        String python = body("double p = pow(2.0, 3.0);", RULE);

        assertTrue(python.startsWith("import math\n"), python);
        assertTrue(python.contains("    p: float = math.pow(2.0, 3.0)\n"), python);
    }

    @Test
    void unknownFunctionsAreLeftAlone() {
        String python = body("int r = compute(1);", RULE);

        assertTrue(python.contains("    r: int = compute(1)\n"), python);
        assertFalse(python.contains("import"), python);
    }
}
