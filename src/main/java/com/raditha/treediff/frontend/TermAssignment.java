package com.raditha.treediff.frontend;

import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.Term;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decides the syntax variant of a parsed node from its category and
 * children. Grammar-specific rules can be layered over
 * {@link DefaultTermAssignment}.
 */
@FunctionalInterface
public interface TermAssignment {

    /**
     * @param source      source text of the node
     * @param category    category of the node
     * @param children    named children, in source order
     * @param allChildren named children plus anonymous tokens such as operator symbols
     * @return the node's syntax
     */
    Syntax assign(String source, Category category, List<Term> children, Supplier<List<Term>> allChildren);
}
