package me.christianrobert.cpp2py.transformation.context;

import java.util.List;

/**
 * Result of translating one C++ translation unit.
 * Contains either the generated Python code or a failure, plus the diagnostics
 * collected along the way. Optionally includes a dump of the rewritten tree for debugging.
 */
public class TranslationResult {

    private final boolean success;
    private final String pythonCode;
    private final String errorMessage;
    private final FailureKind failureKind;
    private final String cppSource;
    private final List<Diagnostic> diagnostics;
    private final String tree;  // Optional tree dump (null by default)

    private TranslationResult(boolean success, String pythonCode, String errorMessage, FailureKind failureKind,
                              String cppSource, List<Diagnostic> diagnostics, String tree) {
        this.success = success;
        this.pythonCode = pythonCode;
        this.errorMessage = errorMessage;
        this.failureKind = failureKind;
        this.cppSource = cppSource;
        this.diagnostics = List.copyOf(diagnostics);
        this.tree = tree;
    }

    /**
     * Creates a successful translation result.
     */
    public static TranslationResult success(String cppSource, String pythonCode, List<Diagnostic> diagnostics) {
        return new TranslationResult(true, pythonCode, null, null, cppSource, diagnostics, null);
    }

    /**
     * Creates a successful translation result with a tree dump.
     */
    public static TranslationResult successWithTree(String cppSource, String pythonCode,
                                                    List<Diagnostic> diagnostics, String tree) {
        return new TranslationResult(true, pythonCode, null, null, cppSource, diagnostics, tree);
    }

    /**
     * Creates a failed translation result.
     */
    public static TranslationResult failure(String cppSource, FailureKind kind, String errorMessage,
                                            List<Diagnostic> diagnostics) {
        return new TranslationResult(false, null, errorMessage, kind, cppSource, diagnostics, null);
    }

    /**
     * Creates a failed translation result from an exception.
     */
    public static TranslationResult failure(String cppSource, FailureKind kind, TranslationException exception) {
        return new TranslationResult(false, null, exception.getMessage(), kind, cppSource, List.of(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPythonCode() {
        return pythonCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getCppSource() {
        return cppSource;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public String getTree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "TranslationResult{success=true, diagnostics=" + diagnostics.size() +
                   (tree != null ? ", hasTree=true" : "") + "}";
        } else {
            return "TranslationResult{success=false, kind=" + failureKind + ", error='" + errorMessage + "'}";
        }
    }
}
