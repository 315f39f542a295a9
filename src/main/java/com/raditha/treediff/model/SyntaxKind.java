package com.raditha.treediff.model;

/**
 * Tag of each {@link Syntax} variant.
 */
public enum SyntaxKind {
    LEAF(false),
    COMMENT(false),
    INDEXED(true),
    FIXED(false),
    KEYED(false),
    FUNCTION_CALL(true),
    FUNCTION(false),
    ASSIGNMENT(false),
    MEMBER_ACCESS(false),
    METHOD_CALL(true),
    IF(true),
    OPERATOR(false),
    PARSE_ERROR(true),
    PAIR(false),
    SWITCH(true),
    CASE(true),
    WHILE(true),
    RETURN(true),
    YIELD(true),
    THROW(false),
    BREAK(false),
    CONTINUE(false);

    private final boolean variadic;

    SyntaxKind(boolean variadic) {
        this.variadic = variadic;
    }

    /**
     * Variadic shapes hold a list of children whose length is not fixed by
     * the grammar: statements, arguments, branches, cases. When two nodes are
     * matched their children are aligned by best match within the siblings;
     * children of fixed shapes pair by position. An operator's operand count
     * is fixed by its operator, so operators are not variadic.
     */
    public boolean isVariadic() {
        return variadic;
    }
}
