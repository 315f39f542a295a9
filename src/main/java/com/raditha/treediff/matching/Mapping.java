package com.raditha.treediff.matching;

import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Partial one-to-one correspondence between the nodes of an old and a new
 * tree.
 * <p>
 * Pairs can only be added, never removed or overwritten; an attempt to map a
 * node twice fails immediately, so the mapping stays injective in both
 * directions by construction.
 */
public final class Mapping {

    private static final int UNMAPPED = -1;

    private final TreeIndex oldTree;
    private final TreeIndex newTree;
    private final int[] oldToNew;
    private final int[] newToOld;
    private int size;

    public Mapping(TreeIndex oldTree, TreeIndex newTree) {
        this.oldTree = oldTree;
        this.newTree = newTree;
        this.oldToNew = new int[oldTree.size()];
        this.newToOld = new int[newTree.size()];
        Arrays.fill(oldToNew, UNMAPPED);
        Arrays.fill(newToOld, UNMAPPED);
    }

    public TreeIndex oldTree() {
        return oldTree;
    }

    public TreeIndex newTree() {
        return newTree;
    }

    /**
     * Add a pair.
     *
     * @throws IllegalArgumentException if a node belongs to neither tree of this mapping
     * @throws IllegalStateException    if either node is already mapped
     */
    public void put(TreeNode oldNode, TreeNode newNode) {
        requireOld(oldNode);
        requireNew(newNode);
        if (oldToNew[oldNode.index()] != UNMAPPED) {
            throw new IllegalStateException("Old node already mapped: " + oldNode);
        }
        if (newToOld[newNode.index()] != UNMAPPED) {
            throw new IllegalStateException("New node already mapped: " + newNode);
        }
        oldToNew[oldNode.index()] = newNode.index();
        newToOld[newNode.index()] = oldNode.index();
        size++;
    }

    public boolean isOldMapped(TreeNode oldNode) {
        requireOld(oldNode);
        return oldToNew[oldNode.index()] != UNMAPPED;
    }

    public boolean isNewMapped(TreeNode newNode) {
        requireNew(newNode);
        return newToOld[newNode.index()] != UNMAPPED;
    }

    /**
     * Both nodes unmapped, so the pair could still be added.
     */
    public boolean isFree(TreeNode oldNode, TreeNode newNode) {
        return !isOldMapped(oldNode) && !isNewMapped(newNode);
    }

    public @Nullable TreeNode newFor(TreeNode oldNode) {
        requireOld(oldNode);
        int target = oldToNew[oldNode.index()];
        return target == UNMAPPED ? null : newTree.get(target);
    }

    public @Nullable TreeNode oldFor(TreeNode newNode) {
        requireNew(newNode);
        int source = newToOld[newNode.index()];
        return source == UNMAPPED ? null : oldTree.get(source);
    }

    /**
     * Check if the two nodes are mapped to each other.
     */
    public boolean contains(TreeNode oldNode, TreeNode newNode) {
        return newFor(oldNode) == newNode;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * All pairs ordered by the old node's pre-order position.
     */
    public List<Pair> pairs() {
        List<Pair> pairs = new ArrayList<>(size);
        for (int i = 0; i < oldToNew.length; i++) {
            if (oldToNew[i] != UNMAPPED) {
                pairs.add(new Pair(oldTree.get(i), newTree.get(oldToNew[i])));
            }
        }
        return pairs;
    }

    private void requireOld(TreeNode node) {
        if (node.tree() != oldTree) {
            throw new IllegalArgumentException("Node does not belong to the old tree: " + node);
        }
    }

    private void requireNew(TreeNode node) {
        if (node.tree() != newTree) {
            throw new IllegalArgumentException("Node does not belong to the new tree: " + node);
        }
    }

    /**
     * One correspondence.
     *
     * @param oldNode node of the old tree
     * @param newNode node of the new tree
     */
    public record Pair(TreeNode oldNode, TreeNode newNode) {
    }

    @Override
    public String toString() {
        return String.format("Mapping[%d of %d old / %d new nodes]", size, oldTree.size(), newTree.size());
    }
}
