package me.christianrobert.cpp2py.transformation.context;

import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

/**
 * Thrown in strict mode when a rewrite rule fails while examining a node.
 */
public class RuleFailureException extends TranslationException {

    private final String ruleName;
    private final SourceLocation location;

    public RuleFailureException(String ruleName, SourceLocation location, Throwable cause) {
        super("Rule " + ruleName + " failed" + (location != null ? " at " + location : "")
                + ": " + cause.getMessage(), null, "rule " + ruleName, cause);
        this.ruleName = ruleName;
        this.location = location;
    }

    public String getRuleName() {
        return ruleName;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
