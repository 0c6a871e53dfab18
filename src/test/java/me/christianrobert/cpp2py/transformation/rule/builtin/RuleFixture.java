package me.christianrobert.cpp2py.transformation.rule.builtin;

import me.christianrobert.cpp2py.transformation.context.TranslationResult;
import me.christianrobert.cpp2py.transformation.engine.RewriteOptions;
import me.christianrobert.cpp2py.transformation.rule.RuleRegistry;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;
import me.christianrobert.cpp2py.transformation.service.TranslationService;
import me.christianrobert.cpp2py.transformation.service.TranslationServiceFixture;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Translates snippets with a chosen subset of the built-in rules.
 */
final class RuleFixture {

    private static final TranslationService SERVICE = TranslationServiceFixture.create();

    private RuleFixture() {
    }

    static TranslationResult translate(String cpp, String... ruleNames) {
        RuleSet rules = RuleSet.select(RuleRegistry.defaultRegistry(), List.of(ruleNames));
        TranslationResult result = SERVICE.convert(cpp, rules, RewriteOptions.defaults());
        assertTrue(result.isSuccess(), () -> "Translation should succeed: " + result.getErrorMessage());
        return result;
    }

    static String python(String cpp, String... ruleNames) {
        return translate(cpp, ruleNames).getPythonCode();
    }

    /**
     * Python after rewriting to a fixed point; fails if the rules do not converge.
     */
    static String fixedPoint(String cpp, String... ruleNames) {
        RuleSet rules = RuleSet.select(RuleRegistry.defaultRegistry(), List.of(ruleNames));
        TranslationResult result = SERVICE.convert(cpp, rules, RewriteOptions.defaults().withFixedPoint(true).withStrict(true));
        assertTrue(result.isSuccess(), () -> "Rewriting should converge: " + result.getErrorMessage());
        return result.getPythonCode();
    }

    /**
     * Python for the statements wrapped in {@code void run() { ... }}.
     */
    static String body(String statements, String... ruleNames) {
        return python("void run() {\n" + statements + "\n}\n", ruleNames);
    }
}
