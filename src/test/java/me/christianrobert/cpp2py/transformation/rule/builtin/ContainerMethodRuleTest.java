package me.christianrobert.cpp2py.transformation.rule.builtin;

import org.junit.jupiter.api.Test;

import static me.christianrobert.cpp2py.transformation.rule.builtin.RuleFixture.body;
import static me.christianrobert.cpp2py.transformation.rule.builtin.RuleFixture.python;
import static org.junit.jupiter.api.Assertions.*;

class ContainerMethodRuleTest {

    private static final String RULE = ContainerMethodRule.NAME;

    @Test
    void vectorMethods() {
        String python = body("std::vector<int> v;\n"
                + "v.push_back(3);\n"
                + "int n = v.size();\n"
                + "bool e = v.empty();\n"
                + "int f = v.front();\n"
                + "int l = v.back();\n"
                + "int x = v.at(0);\n"
                + "v.pop_back();", RULE);

        String expected = "def run():\n"
                + "    v: list[int] = []\n"
                + "    v.append(3)\n"
                + "    n: int = len(v)\n"
                + "    e: bool = len(v) == 0\n"
                + "    f: int = v[0]\n"
                + "    l: int = v[-1]\n"
                + "    x: int = v[0]\n"
                + "    v.pop()\n";
        assertEquals(expected, python);
    }

    @Test
    void stringLength() {
        String python = body("std::string s = \"abc\";\nint n = s.length();", RULE);

        assertTrue(python.contains("    n: int = len(s)\n"), python);
    }

    @Test
    void emptyInCondition() {
        String python = body("std::vector<int> v;\nif (!v.empty()) {\n    v.pop_back();\n}", RULE);

        assertTrue(python.contains("    if not len(v) == 0:\n        v.pop()\n"), python);
    }

    @Test
    void methodsOfUserClassesAreLeftAlone() {
        String cpp = "class Box {\n"
                + "public:\n"
                + "    int size() { return 1; }\n"
                + "};\n"
                + "int measure() {\n"
                + "    Box b;\n"
                + "    return b.size();\n"
                + "}\n";

        String python = python(cpp, RULE);

        assertTrue(python.contains("    return b.size()\n"), python);
    }
}
