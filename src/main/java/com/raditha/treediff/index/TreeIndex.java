package com.raditha.treediff.index;

import com.raditha.treediff.gram.Gram;
import com.raditha.treediff.gram.PqGramExtractor;
import com.raditha.treediff.model.Term;
import com.raditha.treediff.vector.FeatureVector;
import com.raditha.treediff.vector.FeatureVectorEncoder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Read-only annotated view of one tree, built once per comparison.
 * <p>
 * Nodes are numbered in pre-order. For every node the index holds its gram,
 * the feature vector of its subtree, its subtree size and a content hash.
 * Fingerprints are accumulated bottom-up: a node's vector is its own gram's
 * unit vector plus its children's vectors.
 */
public final class TreeIndex {

    private final Term root;
    private final List<TreeNode> nodes = new ArrayList<>();
    private final List<TreeNode> nodesView = Collections.unmodifiableList(nodes);
    private final int dimension;

    private TreeIndex(Term root, int dimension) {
        this.root = root;
        this.dimension = dimension;
    }

    /**
     * Index a tree.
     *
     * @param root      tree to index
     * @param extractor gram extractor shared by both trees of a comparison
     * @param dimension feature vector dimension shared by both trees
     * @return the index
     */
    public static TreeIndex build(Term root, PqGramExtractor extractor, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + dimension);
        }
        TreeIndex index = new TreeIndex(root, dimension);
        index.number();
        index.annotate(extractor.extract(root));
        return index;
    }

    public Term term() {
        return root;
    }

    public TreeNode root() {
        return nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    public int dimension() {
        return dimension;
    }

    public TreeNode get(int preorderIndex) {
        return nodes.get(preorderIndex);
    }

    /** All nodes in pre-order. */
    public List<TreeNode> nodes() {
        return nodesView;
    }

    /**
     * Nodes ordered by decreasing subtree size, ties broken by pre-order.
     */
    public List<TreeNode> bySizeDescending() {
        List<TreeNode> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingInt(TreeNode::size).reversed()
                .thenComparingInt(TreeNode::index));
        return sorted;
    }

    private void number() {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(root, null, 0, 0));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            TreeNode node = new TreeNode(this, nodes.size(), pending.term,
                    pending.parent, pending.childIndex, pending.depth);
            nodes.add(node);
            if (pending.parent != null) {
                pending.parent.addChild(node);
            }
            List<Term> kids = pending.term.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(new Pending(kids.get(i), node, i, pending.depth + 1));
            }
        }
    }

    private void annotate(List<Gram> grams) {
        if (grams.size() != nodes.size()) {
            throw new IllegalStateException(
                    String.format("Expected %d grams, got %d", nodes.size(), grams.size()));
        }
        // Reverse pre-order visits every child before its parent
        for (int i = nodes.size() - 1; i >= 0; i--) {
            TreeNode node = nodes.get(i);
            Gram gram = grams.get(i);
            FeatureVector vector = FeatureVectorEncoder.unit(gram, dimension);
            int size = 1;
            int hash = node.contentKey().hashCode();
            for (TreeNode child : node.children()) {
                vector = vector.plus(child.vector());
                size += child.size();
                hash = 31 * hash + child.subtreeHash();
            }
            hash = 31 * hash + node.children().size();
            node.complete(gram, vector, size, hash);
        }
    }

    private record Pending(Term term, TreeNode parent, int childIndex, int depth) {
    }
}
