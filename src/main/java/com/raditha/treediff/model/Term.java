package com.raditha.treediff.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * A node of a syntax tree: annotation plus shape.
 * <p>
 * Each term exclusively owns its children; trees are immutable and contain
 * no sharing or cycles. Equality is structural, so two identical subtrees at
 * different positions are equal terms. Code that needs positional identity
 * works on a {@link com.raditha.treediff.index.TreeIndex} instead.
 *
 * @param info   annotation produced by the parser
 * @param syntax shape of the node
 */
public record Term(Info info, Syntax syntax) {

    public Term {
        Objects.requireNonNull(info, "info");
        Objects.requireNonNull(syntax, "syntax");
    }

    public Category category() {
        return info.category();
    }

    public SyntaxKind kind() {
        return syntax.kind();
    }

    public List<Term> children() {
        return syntax.children();
    }

    public boolean isLeaf() {
        return syntax.children().isEmpty();
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int size() {
        return fold(0, (count, term) -> count + 1);
    }

    /**
     * Visit every node of the subtree in pre-order, each exactly once.
     */
    public <A> A fold(A seed, BiFunction<A, Term, A> step) {
        A acc = seed;
        Deque<Term> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Term term = stack.pop();
            acc = step.apply(acc, term);
            List<Term> kids = term.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
        return acc;
    }

    /**
     * Rebuild the tree bottom-up: children are transformed first, then the
     * rebuilt node is handed to {@code fn}.
     */
    public Term map(UnaryOperator<Term> fn) {
        Deque<MapFrame> stack = new ArrayDeque<>();
        stack.push(new MapFrame(this));
        Term result = null;
        while (result == null) {
            MapFrame frame = stack.peek();
            List<Term> kids = frame.term.children();
            if (frame.next < kids.size()) {
                stack.push(new MapFrame(kids.get(frame.next++)));
                continue;
            }
            stack.pop();
            Term rebuilt = Objects.requireNonNull(kids.isEmpty()
                    ? fn.apply(frame.term)
                    : fn.apply(new Term(frame.term.info, frame.term.syntax.withChildren(frame.mapped))),
                    "map function returned null");
            if (stack.isEmpty()) {
                result = rebuilt;
            } else {
                stack.peek().mapped.add(rebuilt);
            }
        }
        return result;
    }

    /**
     * Replace the children of this node, keeping annotation and variant.
     */
    public Term withChildren(List<Term> children) {
        return new Term(info, syntax.withChildren(children));
    }

    public static Term of(Category category, Syntax syntax) {
        return new Term(Info.of(category), syntax);
    }

    public static Term leaf(Category category, String text) {
        return of(category, new Syntax.Leaf(text));
    }

    public static Term indexed(Category category, Term... children) {
        return of(category, new Syntax.Indexed(List.of(children)));
    }

    public static Term fixed(Category category, Term... children) {
        return of(category, new Syntax.Fixed(List.of(children)));
    }

    public static Term keyed(Category category, Map<String, Term> entries) {
        return of(category, new Syntax.Keyed(entries));
    }

    private static final class MapFrame {
        private final Term term;
        private final List<Term> mapped = new ArrayList<>();
        private int next;

        MapFrame(Term term) {
            this.term = term;
        }
    }

    @Override
    public String toString() {
        String payload = syntax.payload();
        StringBuilder sb = new StringBuilder();
        sb.append(category()).append(':').append(kind());
        if (!payload.isEmpty() && isLeaf()) {
            sb.append('"').append(payload).append('"');
        }
        List<Term> kids = children();
        if (!kids.isEmpty()) {
            sb.append(kids);
        }
        return sb.toString();
    }
}
