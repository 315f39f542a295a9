package com.raditha.treediff.script;

import com.raditha.treediff.index.TreeNode;

import java.util.List;

/**
 * One step of an edit script. Edits nest: the children of a Copy, Replace
 * or Insert describe what happens below it.
 */
public sealed interface Edit permits Edit.Insert, Edit.Delete, Edit.Replace, Edit.Copy {

    /**
     * Nested edits, in new-tree order.
     */
    List<Edit> children();

    /**
     * A region of the new tree with no counterpart in the old tree.
     *
     * @param newNode  root of the region
     * @param covered  every node of the region, in pre-order, starting with {@code newNode}
     * @param children edits for mapped nodes that sit inside the region
     */
    record Insert(TreeNode newNode, List<TreeNode> covered, List<Edit> children) implements Edit {
        public Insert {
            covered = List.copyOf(covered);
            children = List.copyOf(children);
        }
    }

    /**
     * A region of the old tree with no counterpart in the new tree.
     *
     * @param oldNode root of the region
     * @param covered every node of the region, in pre-order, starting with {@code oldNode}
     */
    record Delete(TreeNode oldNode, List<TreeNode> covered) implements Edit {
        public Delete {
            covered = List.copyOf(covered);
        }

        @Override
        public List<Edit> children() {
            return List.of();
        }
    }

    /**
     * A mapped pair whose node content differs.
     */
    record Replace(TreeNode oldNode, TreeNode newNode, List<Edit> children) implements Edit {
        public Replace {
            children = List.copyOf(children);
        }
    }

    /**
     * A mapped pair with equal node content.
     *
     * @param moved true when the parents of the two nodes do not correspond, or
     *              when the node was reordered among siblings that stayed together
     */
    record Copy(TreeNode oldNode, TreeNode newNode, boolean moved, List<Edit> children) implements Edit {
        public Copy {
            children = List.copyOf(children);
        }
    }
}
