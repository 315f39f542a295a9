package com.raditha.treediff.index;

import com.raditha.treediff.gram.Gram;
import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.SyntaxKind;
import com.raditha.treediff.model.Term;
import com.raditha.treediff.vector.FeatureVector;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node occurrence within a {@link TreeIndex}.
 * <p>
 * Identity is positional: two nodes with identical content at different
 * places are different {@code TreeNode}s, and equality is reference
 * equality. All derived data (gram, fingerprint, size) is computed once when
 * the index is built.
 */
public final class TreeNode {

    private final TreeIndex tree;
    private final int index;
    private final Term term;
    private final @Nullable TreeNode parent;
    private final int childIndex;
    private final int depth;
    private final String contentKey;
    private final List<TreeNode> children = new ArrayList<>();
    private final List<TreeNode> childrenView = Collections.unmodifiableList(children);

    private Gram gram;
    private FeatureVector vector;
    private int size;
    private int subtreeHash;

    TreeNode(TreeIndex tree, int index, Term term, @Nullable TreeNode parent, int childIndex, int depth) {
        this.tree = tree;
        this.index = index;
        this.term = term;
        this.parent = parent;
        this.childIndex = childIndex;
        this.depth = depth;
        this.contentKey = term.category().name() + ":" + term.kind().name() + ":" + term.syntax().payload();
    }

    void addChild(TreeNode child) {
        children.add(child);
    }

    void complete(Gram gram, FeatureVector vector, int size, int subtreeHash) {
        this.gram = gram;
        this.vector = vector;
        this.size = size;
        this.subtreeHash = subtreeHash;
    }

    public TreeIndex tree() {
        return tree;
    }

    /** Pre-order position in the tree, root is 0. */
    public int index() {
        return index;
    }

    public Term term() {
        return term;
    }

    public Category category() {
        return term.category();
    }

    public SyntaxKind kind() {
        return term.kind();
    }

    public @Nullable TreeNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public List<TreeNode> children() {
        return childrenView;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Position among the parent's children, 0 for the root. */
    public int childIndex() {
        return childIndex;
    }

    public int depth() {
        return depth;
    }

    /** Number of nodes in the subtree rooted here. */
    public int size() {
        return size;
    }

    public Gram gram() {
        return gram;
    }

    /** Fingerprint of the whole subtree: the hashed grams of this node and all descendants. */
    public FeatureVector vector() {
        return vector;
    }

    /**
     * Content of the node itself, ignoring children and source positions:
     * category, variant and payload (leaf text, comment text or key order).
     */
    public String contentKey() {
        return contentKey;
    }

    /** Hash of the subtree content, consistent with {@link #sameSubtreeContent}. */
    public int subtreeHash() {
        return subtreeHash;
    }

    /**
     * Check if this node's own content equals another's.
     */
    public boolean sameContent(TreeNode other) {
        return contentKey.equals(other.contentKey);
    }

    /**
     * Check if the two subtrees have identical content and shape, ignoring
     * source positions. Subtrees occupy contiguous pre-order ranges, so this
     * compares them node by node.
     */
    public boolean sameSubtreeContent(TreeNode other) {
        if (size != other.size || subtreeHash != other.subtreeHash) {
            return false;
        }
        for (int k = 0; k < size; k++) {
            TreeNode a = tree.get(index + k);
            TreeNode b = other.tree.get(other.index + k);
            if (a.children.size() != b.children.size() || !a.contentKey.equals(b.contentKey)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Check if {@code other} lies in the subtree rooted at this node.
     */
    public boolean isAncestorOrSelf(TreeNode other) {
        return other.tree == tree && other.index >= index && other.index < index + size;
    }

    /** Relative pre-order position in [0, 1]. */
    public double relativePosition() {
        int last = tree.size() - 1;
        return last == 0 ? 0.0 : (double) index / last;
    }

    @Override
    public String toString() {
        return "#" + index + " " + category() + ":" + kind()
                + (term.isLeaf() && !term.syntax().payload().isEmpty() ? " \"" + term.syntax().payload() + "\"" : "");
    }
}
