package com.raditha.treediff.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Language-independent classification of a parsed node.
 * Grammar-specific node names are mapped onto this vocabulary before the
 * trees reach the matcher, so two trees built from the same grammar always
 * share it.
 */
public enum Category {
    /** Root of a parsed file. */
    PROGRAM,

    COMMENT,

    IDENTIFIER,
    STRING_LITERAL,
    INTEGER_LITERAL,
    FLOAT_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,

    /** Generic operator application. */
    OPERATOR,
    BINARY,
    UNARY,
    RANGE_EXPRESSION,
    SCOPE_OPERATOR,
    BOOLEAN_OPERATOR,
    MATH_OPERATOR,
    RELATIONAL_OPERATOR,
    BITWISE_OPERATOR,

    /** Control flow */
    IF,
    SWITCH,
    CASE,
    WHILE,
    FOR,
    RETURN,
    YIELD,
    THROW,
    BREAK,
    CONTINUE,

    FUNCTION,
    FUNCTION_CALL,
    METHOD_CALL,
    ARGUMENTS,
    PARAMS,
    ASSIGNMENT,
    MEMBER_ACCESS,
    PAIR,
    OBJECT,
    ARRAY,
    CLASS,
    BLOCK,
    EXPRESSION_STATEMENT,
    VAR_DECL,

    /** Whatever the parser could not make sense of. */
    PARSE_ERROR,

    /** Placeholder for nodes that carry nothing; filtered out during assignment. */
    EMPTY,

    OTHER;

    private static final Set<Category> OPERATORS = EnumSet.of(
            OPERATOR,
            BINARY,
            UNARY,
            RANGE_EXPRESSION,
            SCOPE_OPERATOR,
            BOOLEAN_OPERATOR,
            MATH_OPERATOR,
            RELATIONAL_OPERATOR,
            BITWISE_OPERATOR);

    /**
     * Check if this category belongs to the operator family.
     * Operator nodes keep all of their children, including anonymous
     * tokens such as the operator symbol itself.
     */
    public boolean isOperator() {
        return OPERATORS.contains(this);
    }
}
