package com.raditha.treediff.frontend;

import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.Term;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Grammar-independent assignment rules.
 * <p>
 * Operators keep every child including their symbol; control flow and
 * statement categories get their dedicated variants when the children fit
 * the shape; anything else is a leaf with its source text or an indexed
 * node. Children of category {@link Category#EMPTY} are dropped first.
 */
public class DefaultTermAssignment implements TermAssignment {

    @Override
    public Syntax assign(String source, Category category, List<Term> children, Supplier<List<Term>> allChildren) {
        if (category.isOperator()) {
            return new Syntax.Operator(nonEmpty(allChildren.get()));
        }
        List<Term> kids = nonEmpty(children);
        int n = kids.size();

        switch (category) {
            case PARSE_ERROR:
                return new Syntax.ParseError(kids);
            case COMMENT:
                return new Syntax.Comment(source);
            case PAIR:
                if (n == 2) {
                    return new Syntax.Pair(kids.get(0), kids.get(1));
                }
                break;
            case IF:
                if (n > 0) {
                    return new Syntax.If(kids.get(0), kids.subList(1, n));
                }
                break;
            case SWITCH:
                return splitSwitch(kids);
            case CASE:
                if (n > 0) {
                    return new Syntax.Case(kids.get(0), kids.subList(1, n));
                }
                break;
            case WHILE:
                if (n > 0) {
                    return new Syntax.While(kids.get(0), kids.subList(1, n));
                }
                break;
            case RETURN:
                return new Syntax.Return(kids);
            case YIELD:
                return new Syntax.Yield(kids);
            case THROW:
                if (n == 1) {
                    return new Syntax.Throw(kids.get(0));
                }
                break;
            case BREAK:
                if (n <= 1) {
                    return new Syntax.Break(n == 0 ? null : kids.get(0));
                }
                break;
            case CONTINUE:
                if (n <= 1) {
                    return new Syntax.Continue(n == 0 ? null : kids.get(0));
                }
                break;
            default:
                break;
        }
        return n == 0 ? new Syntax.Leaf(source) : new Syntax.Indexed(kids);
    }

    /**
     * Subject is everything before the first case.
     */
    private static Syntax splitSwitch(List<Term> kids) {
        int firstCase = kids.size();
        for (int i = 0; i < kids.size(); i++) {
            if (kids.get(i).category() == Category.CASE) {
                firstCase = i;
                break;
            }
        }
        return new Syntax.Switch(kids.subList(0, firstCase), kids.subList(firstCase, kids.size()));
    }

    private static List<Term> nonEmpty(List<Term> terms) {
        return terms.stream()
                .filter(t -> t.category() != Category.EMPTY)
                .collect(Collectors.toList());
    }
}
