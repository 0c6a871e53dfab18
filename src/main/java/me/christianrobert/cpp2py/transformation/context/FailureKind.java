package me.christianrobert.cpp2py.transformation.context;

/**
 * Why a file could not be translated.
 */
public enum FailureKind {
    PARSE_ERROR,
    STRUCTURAL_ERROR,
    RULE_FAILURE,
    NON_CONVERGENCE,
    INTERNAL_ERROR,
    /** The source could not be read or the output could not be written (batch runs only). */
    IO_ERROR
}
