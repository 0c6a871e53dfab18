package me.christianrobert.cpp2py.transformation.tree;

/**
 * Closed set of node kinds of the internal tree.
 *
 * <p>Every component that dispatches on the kind (code generator, tree formatter)
 * does so with an exhaustive {@code switch} expression, so adding a kind here
 * fails compilation until every matcher handles it.</p>
 */
public enum NodeKind {

    // ========== DEFINITIONS ==========
    MODULE(NodeCategory.MODULE),
    FUNCTION_DEF(NodeCategory.STATEMENT),
    PARAMETER(NodeCategory.PARAMETER),
    CLASS_DEF(NodeCategory.STATEMENT),

    // ========== STATEMENTS ==========
    BLOCK(NodeCategory.STATEMENT),
    FOR_LOOP(NodeCategory.STATEMENT),
    FOR_RANGE(NodeCategory.STATEMENT),
    FOR_EACH(NodeCategory.STATEMENT),
    WHILE_LOOP(NodeCategory.STATEMENT),
    DO_WHILE_LOOP(NodeCategory.STATEMENT),
    IF(NodeCategory.STATEMENT),
    BREAK(NodeCategory.STATEMENT),
    CONTINUE(NodeCategory.STATEMENT),
    RETURN(NodeCategory.STATEMENT),
    EXPRESSION_STATEMENT(NodeCategory.STATEMENT),
    ASSIGNMENT(NodeCategory.STATEMENT),
    OPAQUE(NodeCategory.STATEMENT),

    // ========== EXPRESSIONS ==========
    CALL(NodeCategory.EXPRESSION),
    KEYWORD_ARGUMENT(NodeCategory.KEYWORD),
    IDENTIFIER(NodeCategory.EXPRESSION),
    LITERAL(NodeCategory.EXPRESSION),
    BINARY_OP(NodeCategory.EXPRESSION),
    UNARY_OP(NodeCategory.EXPRESSION),
    MEMBER_ACCESS(NodeCategory.EXPRESSION),
    SUBSCRIPT(NodeCategory.EXPRESSION),
    CAST(NodeCategory.EXPRESSION),
    CONDITIONAL_EXPRESSION(NodeCategory.EXPRESSION),
    LIST_LITERAL(NodeCategory.EXPRESSION),
    TUPLE_LITERAL(NodeCategory.EXPRESSION);

    private final NodeCategory category;

    NodeKind(NodeCategory category) {
        this.category = category;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public boolean isStatement() {
        return category == NodeCategory.STATEMENT;
    }

    public boolean isExpression() {
        return category == NodeCategory.EXPRESSION;
    }
}
