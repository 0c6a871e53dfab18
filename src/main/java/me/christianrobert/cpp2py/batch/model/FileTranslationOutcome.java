package me.christianrobert.cpp2py.batch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import me.christianrobert.cpp2py.transformation.context.FailureKind;

import java.util.List;

/**
 * Result of translating one file in a batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FileTranslationOutcome {

    private final String sourcePath;
    private final String outputPath;
    private final boolean success;
    private final FailureKind failureKind;
    private final String errorMessage;
    private final List<String> diagnostics;
    private final String preview;
    private final String diff;
    private final String tree;

    private FileTranslationOutcome(String sourcePath, String outputPath, boolean success, FailureKind failureKind,
                                   String errorMessage, List<String> diagnostics, String preview, String diff,
                                   String tree) {
        this.sourcePath = sourcePath;
        this.outputPath = outputPath;
        this.success = success;
        this.failureKind = failureKind;
        this.errorMessage = errorMessage;
        this.diagnostics = List.copyOf(diagnostics);
        this.preview = preview;
        this.diff = diff;
        this.tree = tree;
    }

    public static FileTranslationOutcome written(String sourcePath, String outputPath, List<String> diagnostics,
                                                 String tree) {
        return new FileTranslationOutcome(sourcePath, outputPath, true, null, null, diagnostics, null, null, tree);
    }

    public static FileTranslationOutcome previewed(String sourcePath, String outputPath, List<String> diagnostics,
                                                   String pythonCode, String tree) {
        return new FileTranslationOutcome(sourcePath, outputPath, true, null, null, diagnostics, pythonCode, null,
                tree);
    }

    public static FileTranslationOutcome diffed(String sourcePath, String outputPath, List<String> diagnostics,
                                                String diff, String tree) {
        return new FileTranslationOutcome(sourcePath, outputPath, true, null, null, diagnostics, null, diff, tree);
    }

    public static FileTranslationOutcome failed(String sourcePath, FailureKind failureKind, String errorMessage,
                                                List<String> diagnostics) {
        return new FileTranslationOutcome(sourcePath, null, false, failureKind, errorMessage, diagnostics, null, null,
                null);
    }

    public String getSourcePath() {
        return sourcePath;
    }

    /**
     * Where the Python file was (or would be) written.
     */
    public String getOutputPath() {
        return outputPath;
    }

    public boolean isSuccess() {
        return success;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Generated code in dry-run mode.
     */
    public String getPreview() {
        return preview;
    }

    /**
     * Unified diff in show-diff mode; empty when the output would not change.
     */
    public String getDiff() {
        return diff;
    }

    public String getTree() {
        return tree;
    }
}
