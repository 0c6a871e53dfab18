package me.christianrobert.cpp2py.batch.model;

import me.christianrobert.cpp2py.transformation.engine.RewriteOptions;
import me.christianrobert.cpp2py.transformation.rule.RuleSet;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one batch run.
 */
public class BatchTranslationRequest {

    private final Path input;
    private final Path outputDirectory;
    private final OutputMode mode;
    private final RuleSet rules;
    private final RewriteOptions options;
    private final int workers;
    private final List<String> extensions;
    private final boolean includeTree;

    /**
     * @param input a source file or a directory searched recursively
     * @param outputDirectory root of the mirrored output tree, or null to write next to each source
     * @param extensions lower-case file suffixes including the dot (".cpp")
     */
    public BatchTranslationRequest(Path input, Path outputDirectory, OutputMode mode, RuleSet rules,
                                   RewriteOptions options, int workers, List<String> extensions,
                                   boolean includeTree) {
        this.input = Objects.requireNonNull(input, "input");
        this.outputDirectory = outputDirectory;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.options = Objects.requireNonNull(options, "options");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        this.workers = workers;
        this.extensions = List.copyOf(extensions);
        this.includeTree = includeTree;
    }

    public Path getInput() {
        return input;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public OutputMode getMode() {
        return mode;
    }

    public RuleSet getRules() {
        return rules;
    }

    public RewriteOptions getOptions() {
        return options;
    }

    public int getWorkers() {
        return workers;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isIncludeTree() {
        return includeTree;
    }
}
