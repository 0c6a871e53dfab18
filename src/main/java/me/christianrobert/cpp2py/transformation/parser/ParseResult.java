package me.christianrobert.cpp2py.transformation.parser;

import me.christianrobert.cpp2py.antlr.CppParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of parsing one C++ translation unit.
 * Contains the parse tree and any syntax errors encountered.
 */
public class ParseResult {

    private final CppParser.TranslationUnitContext tree;
    private final List<String> errors;
    private final String originalSource;

    public ParseResult(CppParser.TranslationUnitContext tree, List<String> errors, String originalSource) {
        this.tree = tree;
        this.errors = new ArrayList<>(errors);
        this.originalSource = originalSource;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public CppParser.TranslationUnitContext getTree() {
        return tree;
    }

    /**
     * Gets the list of syntax errors encountered during lexing and parsing.
     */
    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public String getOriginalSource() {
        return originalSource;
    }

    /**
     * Checks if parsing was successful (no errors).
     */
    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Gets a formatted error message combining all errors.
     */
    public String getErrorMessage() {
        if (errors.isEmpty()) {
            return null;
        }
        return String.join("\n", errors);
    }

    @Override
    public String toString() {
        return "ParseResult{success=" + isSuccess() + ", errors=" + errors.size() + "}";
    }
}
