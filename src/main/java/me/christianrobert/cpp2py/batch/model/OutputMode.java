package me.christianrobert.cpp2py.batch.model;

/**
 * What a batch run does with each successful translation.
 */
public enum OutputMode {
    /** Write the Python file next to the source or under the output directory. */
    WRITE,
    /** Keep the generated code in the report, write nothing. */
    DRY_RUN,
    /** Record a unified diff against the existing output file, write nothing. */
    SHOW_DIFF
}
