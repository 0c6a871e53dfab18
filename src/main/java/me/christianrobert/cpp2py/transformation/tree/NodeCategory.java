package me.christianrobert.cpp2py.transformation.tree;

/**
 * Coarse role of a node kind. Slot validation is expressed in terms of categories.
 */
public enum NodeCategory {
    MODULE,
    STATEMENT,
    EXPRESSION,
    PARAMETER,
    KEYWORD
}
