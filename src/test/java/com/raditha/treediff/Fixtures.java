package com.raditha.treediff;

import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.Term;

import java.util.List;

/**
 * Hand-built trees shared by tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * {@code left + right} as a one-statement program.
     */
    public static Term sum(String left, String right) {
        Term operator = Term.of(Category.MATH_OPERATOR, new Syntax.Operator(List.of(
                Term.leaf(Category.IDENTIFIER, left),
                Term.leaf(Category.OTHER, "+"),
                Term.leaf(Category.IDENTIFIER, right))));
        return Term.indexed(Category.PROGRAM, Term.indexed(Category.EXPRESSION_STATEMENT, operator));
    }

    /**
     * A block of statements {@code name();} for each name.
     */
    public static Term calls(String... names) {
        Term[] statements = new Term[names.length];
        for (int i = 0; i < names.length; i++) {
            statements[i] = Term.indexed(Category.EXPRESSION_STATEMENT,
                    Term.of(Category.FUNCTION_CALL, new Syntax.FunctionCall(
                            Term.leaf(Category.IDENTIFIER, names[i]), List.of())));
        }
        return Term.indexed(Category.PROGRAM, Term.indexed(Category.BLOCK, statements));
    }
}
