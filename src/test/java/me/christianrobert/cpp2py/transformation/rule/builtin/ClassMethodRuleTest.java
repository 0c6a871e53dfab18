package me.christianrobert.cpp2py.transformation.rule.builtin;

import org.junit.jupiter.api.Test;

import static me.christianrobert.cpp2py.transformation.rule.builtin.RuleFixture.python;
import static org.junit.jupiter.api.Assertions.*;

class ClassMethodRuleTest {

    private static final String RULE = ClassMethodRule.NAME;

    @Test
    void constructorMethodsAndFields() {
        String cpp = "class Counter {\n"
                + "public:\n"
                + "    Counter(int start) : count(start) {}\n"
                + "    void increment() { count++; }\n"
                + "    int get() const { return count; }\n"
                + "private:\n"
                + "    int count;\n"
                + "};\n";

        String python = python(cpp, IncrementToAugmentedAssignmentRule.NAME, RULE);

        String expected = "class Counter:\n"
                + "    def __init__(self, start: int):\n"
                + "        self.count = start\n"
                + "\n"
                + "    def increment(self):\n"
                + "        self.count += 1\n"
                + "\n"
                + "    def get(self) -> int:\n"
                + "        return self.count\n";
        assertEquals(expected, python);
    }

    @Test
    void parameterShadowsField() {
        String cpp = "class Holder {\n"
                + "public:\n"
                + "    void set(int value) { this->value = value; }\n"
                + "    int value;\n"
                + "};\n";

        String python = python(cpp, RULE);

        assertTrue(python.contains("    def set(self, value: int):\n        self.value = value\n"), python);
    }

    @Test
    void instanceMethodCallsGoThroughSelf() {
        String cpp = "class Pair {\n"
                + "public:\n"
                + "    int one() { return 1; }\n"
                + "    int two() { return one() + one(); }\n"
                + "};\n";

        String python = python(cpp, RULE);

        assertTrue(python.contains("        return self.one() + self.one()\n"), python);
    }

    @Test
    void staticMethodsAreQualifiedWithClassName() {
        String cpp = "class Util {\n"
                + "public:\n"
                + "    static int one() { return 1; }\n"
                + "    static int two() { return one() + one(); }\n"
                + "};\n";

        String python = python(cpp, RULE);

        assertTrue(python.contains("    @staticmethod\n    def two() -> int:\n        return Util.one() + Util.one()\n"),
                python);
    }

    @Test
    void fieldDefaultsAreInitializedPerInstance() {
        String cpp = "class Bag {\n"
                + "public:\n"
                + "    std::vector<int> items;\n"
                + "    void add(int x) { items.push_back(x); }\n"
                + "};\n";

        String python = python(cpp, ContainerMethodRule.NAME, RULE);

        String expected = "class Bag:\n"
                + "    def __init__(self):\n"
                + "        self.items: list[int] = []\n"
                + "\n"
                + "    def add(self, x: int):\n"
                + "        self.items.append(x)\n";
        assertEquals(expected, python);
    }

    @Test
    void fieldDefaultsPrecedeConstructorBody() {
        String cpp = "class Base {\n"
                + "};\n"
                + "class Stack : public Base {\n"
                + "public:\n"
                + "    Stack(int limit) : Base(), limit(limit) { depth = 1; }\n"
                + "private:\n"
                + "    int limit;\n"
                + "    int depth = 0;\n"
                + "};\n";

        String python = python(cpp, RULE);

        assertTrue(python.contains("    def __init__(self, limit: int):\n"
                + "        super().__init__()\n"
                + "        self.depth: int = 0\n"
                + "        self.limit = limit\n"
                + "        self.depth = 1\n"), python);
        assertFalse(python.contains("self.limit: int"), "A member initializer replaces the default");
    }

    @Test
    void staticFieldsStayOnTheClass() {
        String cpp = "class Registry {\n"
                + "public:\n"
                + "    static int created;\n"
                + "    int id;\n"
                + "    Registry() { created += 1; id = created; }\n"
                + "};\n";

        String python = python(cpp, RULE);

        assertTrue(python.startsWith("class Registry:\n    created: int = None\n"), python);
        assertTrue(python.contains("        self.id: int = None\n"
                + "        Registry.created += 1\n"
                + "        self.id = Registry.created\n"), python);
    }

    @Test
    void ruleIsIdempotent() {
        String cpp = "class Counter {\n"
                + "public:\n"
                + "    Counter(int start) : count(start) {}\n"
                + "    int get() const { return count; }\n"
                + "private:\n"
                + "    int count;\n"
                + "};\n";

        assertEquals(python(cpp, RULE), RuleFixture.fixedPoint(cpp, RULE));
    }
}
