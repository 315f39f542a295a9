package com.raditha.treediff.gram;

import com.raditha.treediff.model.Term;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Computes one {@link Gram} per node of a tree.
 * <p>
 * Grams are produced in pre-order, so the i-th gram belongs to the i-th node
 * of a pre-order walk. The traversal is iterative; deeply nested trees do not
 * grow the call stack.
 */
public class PqGramExtractor {

    private final int p;
    private final int q;
    private final LabelFunction labels;

    /**
     * @param p      number of ancestor labels in the stem
     * @param q      number of labels in the base (the node and q-1 right siblings)
     * @param labels label function
     */
    public PqGramExtractor(int p, int q, LabelFunction labels) {
        if (p <= 0 || q <= 0) {
            throw new IllegalArgumentException(
                    String.format("p and q must be positive, got p=%d, q=%d", p, q));
        }
        this.p = p;
        this.q = q;
        this.labels = labels;
    }

    public PqGramExtractor(int p, int q) {
        this(p, q, LabelFunction.CATEGORY);
    }

    /**
     * Extract the grams of every node, in pre-order.
     */
    public List<Gram> extract(Term root) {
        List<Gram> grams = new ArrayList<>();
        List<String> path = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 0, List.of(labels.label(root)), 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            while (path.size() > frame.depth) {
                path.remove(path.size() - 1);
            }
            grams.add(new Gram(stem(path), base(frame.siblingLabels, frame.index)));
            path.add(frame.siblingLabels.get(frame.index));

            List<Term> kids = frame.term.children();
            if (kids.isEmpty()) {
                continue;
            }
            List<String> kidLabels = kids.stream().map(labels::label).toList();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Frame(kids.get(i), frame.depth + 1, kidLabels, i));
            }
        }
        return grams;
    }

    private List<String> stem(List<String> path) {
        List<String> stem = new ArrayList<>(p);
        for (int i = path.size() - 1; i >= 0 && stem.size() < p; i--) {
            stem.add(path.get(i));
        }
        while (stem.size() < p) {
            stem.add(Gram.ABSENT);
        }
        return stem;
    }

    private List<String> base(List<String> siblings, int index) {
        List<String> base = new ArrayList<>(q);
        for (int i = index; i < siblings.size() && base.size() < q; i++) {
            base.add(siblings.get(i));
        }
        while (base.size() < q) {
            base.add(Gram.ABSENT);
        }
        return base;
    }

    private record Frame(Term term, int depth, List<String> siblingLabels, int index) {
    }
}
