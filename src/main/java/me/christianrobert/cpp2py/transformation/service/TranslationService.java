package me.christianrobert.cpp2py.transformation.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.cpp2py.transformation.builder.ConversionResult;
import me.christianrobert.cpp2py.transformation.builder.TreeConverter;
import me.christianrobert.cpp2py.transformation.codegen.PythonCodeGenerator;
import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.context.FailureKind;
import me.christianrobert.cpp2py.transformation.context.NonConvergenceException;
import me.christianrobert.cpp2py.transformation.context.RuleFailureException;
import me.christianrobert.cpp2py.transformation.context.StructuralException;
import me.christianrobert.cpp2py.transformation.context.TranslationException;
import me.christianrobert.cpp2py.transformation.context.TranslationResult;
import me.christianrobert.cpp2py.transformation.engine.RewriteEngine;
import me.christianrobert.cpp2py.transformation.engine.RewriteOptions;
import me.christianrobert.cpp2py.transformation.engine.RewriteResult;
import me.christianrobert.cpp2py.transformation.parser.AntlrParser;
import me.christianrobert.cpp2py.transformation.parser.ParseResult;
import me.christianrobert.cpp2py.transformation.rule.RuleRegistry;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;
import me.christianrobert.cpp2py.transformation.tree.Nodes;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;
import me.christianrobert.cpp2py.transformation.util.NodeTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates one C++ source text to Python.
 *
 * <p>Pipeline:
 * <pre>
 * C++ source → ANTLR parse → TreeConverter → RewriteEngine (rule set) → PythonCodeGenerator → Python source
 *                  ↓               ↓                  ↓
 *              CppParser     tree + diagnostics   rewritten tree + diagnostics
 * </pre>
 *
 * <p>Recoverable problems (unsupported constructs, failing rules, non-convergence) are
 * reported as diagnostics on a successful result. Fatal problems (syntax errors,
 * ill-formed trees, strict-mode failures) produce a failed result. This service never
 * throws for a non-null source.</p>
 */
@ApplicationScoped
public class TranslationService {

    private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

    @Inject
    AntlrParser parser;

    @Inject
    RewriteEngine engine;

    @Inject
    PythonCodeGenerator generator;

    /**
     * Translates with every built-in rule in a single pass.
     */
    public TranslationResult convert(String cppSource) {
        return convert(cppSource, RuleSet.all(RuleRegistry.defaultRegistry()), RewriteOptions.defaults(), false);
    }

    public TranslationResult convert(String cppSource, RuleSet rules, RewriteOptions options) {
        return convert(cppSource, rules, options, false);
    }

    /**
     * Master translation method that all other overloads delegate to.
     *
     * @param cppSource C++ translation unit text
     * @param rules active rules, applied in their order
     * @param options engine options (fixed point, pass bound, strict mode)
     * @param includeTree whether to attach a dump of the rewritten tree (for debugging)
     * @return the Python code with diagnostics, or the failure kind and message
     */
    public TranslationResult convert(String cppSource, RuleSet rules, RewriteOptions options, boolean includeTree) {
        if (cppSource == null) {
            return TranslationResult.failure(null, FailureKind.INTERNAL_ERROR, "C++ source cannot be null", List.of());
        }

        log.trace("C++ source: {}", cppSource);

        try {
            // STEP 1: Parse
            log.debug("Step 1: Parsing C++ source");
            ParseResult parseResult = parser.parse(cppSource);
            if (parseResult.hasErrors()) {
                String errorMsg = "Parse errors: " + parseResult.getErrorMessage();
                log.warn("Parse failed: {}", errorMsg);
                return TranslationResult.failure(cppSource, FailureKind.PARSE_ERROR, errorMsg, List.of());
            }

            // STEP 2: Convert the parse tree to the internal tree
            log.debug("Step 2: Converting parse tree");
            ConversionResult conversion = TreeConverter.convert(parseResult.getTree());
            List<Diagnostic> diagnostics = new ArrayList<>(conversion.getDiagnostics());
            log.debug("Conversion produced {} diagnostic(s)", conversion.getDiagnostics().size());

            // STEP 3: Rewrite
            log.debug("Step 3: Rewriting with {}", rules);
            RewriteResult rewrite = engine.rewrite(conversion.getModule(), rules, options);
            diagnostics.addAll(rewrite.getDiagnostics());
            Module module = Nodes.requireKind(rewrite.getTree(), Module.class, "rewritten root");
            log.debug("Rewriting finished after {} pass(es) with {} change(s)", rewrite.getPasses(), rewrite.getChanges());

            // STEP 4: Generate
            log.debug("Step 4: Generating Python");
            String pythonCode = generator.generate(module);
            log.debug("Python code: {}", pythonCode);

            if (includeTree) {
                return TranslationResult.successWithTree(cppSource, pythonCode, diagnostics,
                        NodeTreeFormatter.format(module));
            }
            return TranslationResult.success(cppSource, pythonCode, diagnostics);

        } catch (StructuralException e) {
            log.error("Ill-formed tree: {}", e.getDetailedMessage(), e);
            return TranslationResult.failure(cppSource, FailureKind.STRUCTURAL_ERROR, e);

        } catch (RuleFailureException e) {
            log.error("Rule failure in strict mode: {}", e.getMessage());
            return TranslationResult.failure(cppSource, FailureKind.RULE_FAILURE, e);

        } catch (NonConvergenceException e) {
            log.error("Rewriting did not converge in strict mode: {}", e.getMessage());
            return TranslationResult.failure(cppSource, FailureKind.NON_CONVERGENCE, e);

        } catch (TranslationException e) {
            log.error("Translation failed: {}", e.getDetailedMessage(), e);
            return TranslationResult.failure(cppSource, FailureKind.INTERNAL_ERROR, e);

        } catch (Exception e) {
            log.error("Unexpected error during translation", e);
            String errorMsg = "Unexpected error: " + e.getMessage();
            return TranslationResult.failure(cppSource, FailureKind.INTERNAL_ERROR, errorMsg, List.of());
        }
    }
}
