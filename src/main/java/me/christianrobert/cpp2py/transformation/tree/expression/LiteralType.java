package me.christianrobert.cpp2py.transformation.tree.expression;

public enum LiteralType {
    INTEGER,
    FLOAT,
    /** Value is the escaped string body without quotes. */
    STRING,
    /** Value is "True" or "False". */
    BOOLEAN,
    NONE
}
