package me.christianrobert.cpp2py.transformation.context;

/**
 * Recoverable issues reported alongside a translation.
 */
public enum DiagnosticKind {
    /** A construct outside the supported subset was passed through as a comment. */
    UNSUPPORTED_CONSTRUCT,
    /** A rule raised while examining a node; the node was left unchanged by that rule. */
    RULE_FAILURE,
    /** Fixed-point rewriting hit its pass limit. */
    NON_CONVERGENCE
}
