package me.christianrobert.cpp2py.transformation.context;

import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

import java.util.Objects;

/**
 * A single recoverable issue found while translating one file.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;
    private final String message;
    private final SourceLocation location;
    private final String ruleName;

    private Diagnostic(DiagnosticKind kind, String message, SourceLocation location, String ruleName) {
        this.kind = kind;
        this.message = message;
        this.location = location;
        this.ruleName = ruleName;
    }

    public static Diagnostic unsupported(String message, SourceLocation location) {
        return new Diagnostic(DiagnosticKind.UNSUPPORTED_CONSTRUCT, message, location, null);
    }

    public static Diagnostic ruleFailure(String ruleName, String message, SourceLocation location) {
        return new Diagnostic(DiagnosticKind.RULE_FAILURE, message, location, ruleName);
    }

    public static Diagnostic nonConvergence(int passes) {
        return new Diagnostic(DiagnosticKind.NON_CONVERGENCE,
                "No fixed point after " + passes + " passes, keeping the last tree", null, null);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Name of the failing rule for RULE_FAILURE diagnostics, null otherwise.
     */
    public String getRuleName() {
        return ruleName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Diagnostic)) {
            return false;
        }
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind
                && Objects.equals(message, that.message)
                && Objects.equals(location, that.location)
                && Objects.equals(ruleName, that.ruleName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, location, ruleName);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (location != null) {
            sb.append(" (").append(location).append(")");
        }
        if (ruleName != null) {
            sb.append(" [").append(ruleName).append("]");
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
