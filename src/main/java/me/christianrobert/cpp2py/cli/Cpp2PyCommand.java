package me.christianrobert.cpp2py.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import jakarta.inject.Inject;
import me.christianrobert.cpp2py.batch.job.BatchTranslationJob;
import me.christianrobert.cpp2py.batch.model.BatchTranslationReport;
import me.christianrobert.cpp2py.batch.model.BatchTranslationRequest;
import me.christianrobert.cpp2py.batch.model.FileTranslationOutcome;
import me.christianrobert.cpp2py.batch.model.OutputMode;
import me.christianrobert.cpp2py.batch.service.DiffRenderer;
import me.christianrobert.cpp2py.batch.service.OutputPathResolver;
import me.christianrobert.cpp2py.batch.service.ReportWriter;
import me.christianrobert.cpp2py.batch.service.SourceFileCollector;
import me.christianrobert.cpp2py.config.service.ConfigService;
import me.christianrobert.cpp2py.transformation.engine.RewriteOptions;
import me.christianrobert.cpp2py.transformation.rule.Rule;
import me.christianrobert.cpp2py.transformation.rule.RuleRegistry;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;
import me.christianrobert.cpp2py.transformation.service.TranslationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <pre>
 * cpp2py [-o &lt;dir&gt;] [--dry-run | --show-diff] [--rules a,b] [--fixed-point] [--max-passes n]
 *        [--strict] [--workers n] [--show-tree] [--report file.json] &lt;input&gt;
 * cpp2py --list-rules
 * </pre>
 *
 * Exit codes: 0 when every file translated, 1 when at least one failed, 2 for invalid
 * arguments or a missing input path.
 */
@TopCommand
@CommandLine.Command(
        name = "cpp2py",
        mixinStandardHelpOptions = true,
        description = "Translate C++ sources to Python by tree rewriting")
public class Cpp2PyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Cpp2PyCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    @Inject
    TranslationService translationService;

    @Inject
    ConfigService configService;

    @Inject
    SourceFileCollector collector;

    @Inject
    OutputPathResolver pathResolver;

    @Inject
    DiffRenderer diffRenderer;

    @Inject
    ReportWriter reportWriter;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "C++ file or directory to translate")
    Path input;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output directory (default: next to each source)")
    Path output;

    @CommandLine.Option(names = "--dry-run", description = "Print the generated Python instead of writing files")
    boolean dryRun;

    @CommandLine.Option(names = "--show-diff", description = "Print a unified diff against existing output files")
    boolean showDiff;

    @CommandLine.Option(names = "--rules", split = ",", description = "Comma-separated rule names (default: all)")
    List<String> rules;

    @CommandLine.Option(names = "--list-rules", description = "List the available rules and exit")
    boolean listRules;

    @CommandLine.Option(names = "--fixed-point", description = "Repeat rewrite passes until nothing changes")
    boolean fixedPoint;

    @CommandLine.Option(names = "--max-passes", description = "Pass limit in fixed-point mode (default: 10)")
    Integer maxPasses;

    @CommandLine.Option(names = "--strict", description = "Fail a file on the first rule failure or non-convergence")
    boolean strict;

    @CommandLine.Option(names = "--workers", description = "Number of files translated in parallel")
    Integer workers;

    @CommandLine.Option(names = "--show-tree", description = "Print the rewritten tree of each file")
    boolean showTree;

    @CommandLine.Option(names = "--report", description = "Write a JSON report to this file")
    Path report;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (listRules) {
            RuleRegistry registry = RuleRegistry.defaultRegistry();
            for (String name : registry.names()) {
                Rule rule = registry.create(name);
                out.printf("%-36s %s%n", name, rule.getDescription());
            }
            out.flush();
            return EXIT_OK;
        }

        if (input == null) {
            err.println("Missing input file or directory");
            err.flush();
            return EXIT_USAGE;
        }
        if (!Files.exists(input)) {
            err.println("Input path does not exist: " + input);
            err.flush();
            return EXIT_USAGE;
        }
        if (dryRun && showDiff) {
            err.println("--dry-run and --show-diff cannot be combined");
            err.flush();
            return EXIT_USAGE;
        }

        applyOverrides();

        RuleSet ruleSet;
        RewriteOptions options;
        try {
            ruleSet = selectRules();
            options = new RewriteOptions(
                    Boolean.TRUE.equals(configService.getConfigValueAsBoolean(ConfigService.FIXED_POINT)),
                    valueOr(configService.getConfigValueAsInteger(ConfigService.MAX_PASSES),
                            RewriteOptions.DEFAULT_MAX_PASSES),
                    Boolean.TRUE.equals(configService.getConfigValueAsBoolean(ConfigService.STRICT)));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.flush();
            return EXIT_USAGE;
        }

        OutputMode mode = dryRun ? OutputMode.DRY_RUN : showDiff ? OutputMode.SHOW_DIFF : OutputMode.WRITE;
        int workerCount = Math.max(1, valueOr(configService.getConfigValueAsInteger(ConfigService.WORKERS), 1));
        BatchTranslationRequest request = new BatchTranslationRequest(input, output, mode, ruleSet, options,
                workerCount, configService.getConfigValueAsStringList(ConfigService.SOURCE_EXTENSIONS), showTree);

        BatchTranslationJob job = new BatchTranslationJob(request, translationService, collector, pathResolver,
                diffRenderer);
        log.debug("Starting {}: {}", job.getJobId(), job.getDescription());

        BatchTranslationReport result;
        try {
            result = job.run(progress -> log.debug("{}% {} {}", progress.getPercentage(),
                    progress.getCurrentTask(), progress.getDetails()));
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            err.flush();
            return EXIT_USAGE;
        }

        print(result, out, err);

        if (report != null) {
            try {
                reportWriter.write(result, report);
            } catch (IOException e) {
                err.println("Cannot write report: " + e.getMessage());
                err.flush();
                return EXIT_FAILURES;
            }
        }
        return result.allSucceeded() ? EXIT_OK : EXIT_FAILURES;
    }

    /**
     * Command line options override the configuration defaults.
     */
    private void applyOverrides() {
        Map<String, Object> overrides = new HashMap<>();
        if (rules != null) {
            overrides.put(ConfigService.RULES, String.join(",", rules));
        }
        if (fixedPoint) {
            overrides.put(ConfigService.FIXED_POINT, true);
        }
        if (maxPasses != null) {
            overrides.put(ConfigService.MAX_PASSES, maxPasses);
        }
        if (strict) {
            overrides.put(ConfigService.STRICT, true);
        }
        if (workers != null) {
            overrides.put(ConfigService.WORKERS, workers);
        }
        if (!overrides.isEmpty()) {
            configService.updateConfiguration(overrides);
        }
    }

    private RuleSet selectRules() {
        List<String> names = configService.getConfigValueAsStringList(ConfigService.RULES);
        RuleRegistry registry = RuleRegistry.defaultRegistry();
        return names.isEmpty() ? RuleSet.all(registry) : RuleSet.select(registry, names);
    }

    private static void print(BatchTranslationReport result, PrintWriter out, PrintWriter err) {
        for (FileTranslationOutcome outcome : result.getOutcomes()) {
            for (String diagnostic : outcome.getDiagnostics()) {
                err.println(outcome.getSourcePath() + ": " + diagnostic);
            }
            if (!outcome.isSuccess()) {
                err.println("FAILED " + outcome.getSourcePath() + ": " + outcome.getErrorMessage());
                continue;
            }
            if (outcome.getTree() != null) {
                out.println("# tree of " + outcome.getSourcePath());
                out.print(outcome.getTree());
            }
            if (outcome.getPreview() != null) {
                out.println("# ==> " + outcome.getOutputPath());
                out.print(outcome.getPreview());
            } else if (outcome.getDiff() != null) {
                out.print(outcome.getDiff());
            } else {
                out.println("Translated " + outcome.getSourcePath() + " -> " + outcome.getOutputPath());
            }
        }
        out.printf("%d file(s): %d succeeded, %d failed%n", result.getTotalFiles(), result.getSucceeded(),
                result.getFailed());
        out.flush();
        err.flush();
    }

    private static int valueOr(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
