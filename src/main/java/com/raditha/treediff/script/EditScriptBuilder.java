package com.raditha.treediff.script;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.matching.Mapping;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a mapping into an edit script.
 * <p>
 * The new tree is walked in pre-order. A mapped node becomes a Copy when its
 * own content equals its partner's and a Replace otherwise. A maximal
 * unmapped region of the new tree becomes one Insert and a maximal unmapped
 * region of the old tree one Delete, placed among the edits of its mapped
 * parent's partner at its original child index.
 * <p>
 * A Copy is moved when its parent changed, or when it stays under the same
 * parent but falls outside the longest run of children that kept their
 * relative order.
 * <p>
 * The walk uses an explicit stack, so the depth of the trees is not limited
 * by the call stack.
 */
public class EditScriptBuilder {

    public EditScript build(Mapping mapping) {
        List<Pending> created = new ArrayList<>();
        Deque<Pending> work = new ArrayDeque<>();

        List<Pending> top = new ArrayList<>();
        TreeNode oldRoot = mapping.oldTree().root();
        if (!mapping.isOldMapped(oldRoot)) {
            top.add(delete(mapping, oldRoot, created));
        }
        TreeNode newRoot = mapping.newTree().root();
        top.add(open(mapping, newRoot, isReparented(mapping, newRoot), created, work));

        while (!work.isEmpty()) {
            Pending pair = work.pop();
            expand(mapping, pair, created, work);
        }

        // Children are always created after their parent
        for (int i = created.size() - 1; i >= 0; i--) {
            created.get(i).complete();
        }
        List<Edit> edits = new ArrayList<>(top.size());
        for (Pending pending : top) {
            edits.add(pending.edit);
        }
        return new EditScript(edits);
    }

    /**
     * Pending edit for a node of the new tree: an Insert for an unmapped node,
     * otherwise a Copy or Replace whose children are filled in later.
     */
    private Pending open(Mapping mapping, TreeNode newNode, boolean moved,
                         List<Pending> created, Deque<Pending> work) {
        TreeNode oldNode = mapping.oldFor(newNode);
        if (oldNode == null) {
            return insert(mapping, newNode, created, work);
        }
        Pending pending = new Pending(oldNode, newNode, List.of(), moved);
        created.add(pending);
        work.push(pending);
        return pending;
    }

    private static boolean isReparented(Mapping mapping, TreeNode newNode) {
        TreeNode oldNode = mapping.oldFor(newNode);
        if (oldNode == null) {
            return false;
        }
        TreeNode oldParent = oldNode.parent();
        TreeNode newParent = newNode.parent();
        if (oldParent == null || newParent == null) {
            return oldParent != newParent;
        }
        return !mapping.contains(oldParent, newParent);
    }

    /**
     * Edits below a mapped pair: deletes of unmapped old children merged by
     * child index in front of the edits of the new children.
     */
    private void expand(Mapping mapping, Pending pair, List<Pending> created, Deque<Pending> work) {
        List<TreeNode> olds = pair.oldNode.children();
        List<TreeNode> news = pair.newNode.children();
        Set<TreeNode> reordered = reorderedChildren(mapping, pair.oldNode, pair.newNode);

        int span = Math.max(olds.size(), news.size());
        for (int k = 0; k < span; k++) {
            if (k < olds.size() && !mapping.isOldMapped(olds.get(k))) {
                pair.children.add(delete(mapping, olds.get(k), created));
            }
            if (k < news.size()) {
                TreeNode newChild = news.get(k);
                boolean moved = reordered.contains(newChild) || isReparented(mapping, newChild);
                pair.children.add(open(mapping, newChild, moved, created, work));
            }
        }
    }

    /**
     * New children that stayed under the same parent but left the longest
     * order-preserving run of such children.
     */
    private static Set<TreeNode> reorderedChildren(Mapping mapping, TreeNode oldNode, TreeNode newNode) {
        List<Integer> oldOrder = new ArrayList<>();
        for (TreeNode oldChild : oldNode.children()) {
            TreeNode partner = mapping.newFor(oldChild);
            if (partner != null && partner.parent() == newNode) {
                oldOrder.add(partner.childIndex());
            }
        }
        if (oldOrder.size() < 2) {
            return Set.of();
        }
        List<Integer> newOrder = new ArrayList<>(oldOrder);
        newOrder.sort(null);
        if (newOrder.equals(oldOrder)) {
            return Set.of();
        }

        Set<TreeNode> reordered = new HashSet<>();
        Patch<Integer> patch = DiffUtils.diff(oldOrder, newOrder);
        for (AbstractDelta<Integer> delta : patch.getDeltas()) {
            for (Integer childIndex : delta.getTarget().getLines()) {
                reordered.add(newNode.children().get(childIndex));
            }
        }
        return reordered;
    }

    private Pending insert(Mapping mapping, TreeNode newRoot, List<Pending> created, Deque<Pending> work) {
        List<TreeNode> covered = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(newRoot);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            covered.add(node);
            List<TreeNode> kids = node.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                if (!mapping.isNewMapped(kids.get(i))) {
                    stack.push(kids.get(i));
                }
            }
        }
        Pending pending = new Pending(null, newRoot, covered, false);
        created.add(pending);

        // Mapped nodes hanging off the region, in new pre-order
        List<TreeNode> nested = new ArrayList<>();
        for (TreeNode node : covered) {
            for (TreeNode kid : node.children()) {
                if (mapping.isNewMapped(kid)) {
                    nested.add(kid);
                }
            }
        }
        nested.sort((a, b) -> Integer.compare(a.index(), b.index()));
        for (TreeNode kid : nested) {
            pending.children.add(open(mapping, kid, true, created, work));
        }
        return pending;
    }

    private static Pending delete(Mapping mapping, TreeNode oldRoot, List<Pending> created) {
        List<TreeNode> covered = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(oldRoot);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            covered.add(node);
            List<TreeNode> kids = node.children();
            for (int i = kids.size() - 1; i >= 0; i--) {
                if (!mapping.isOldMapped(kids.get(i))) {
                    stack.push(kids.get(i));
                }
            }
        }
        Pending pending = new Pending(oldRoot, null, covered, false);
        created.add(pending);
        return pending;
    }

    /**
     * An edit whose children are still being collected.
     */
    private static final class Pending {
        private final TreeNode oldNode;
        private final TreeNode newNode;
        private final List<TreeNode> covered;
        private final boolean moved;
        private final List<Pending> children = new ArrayList<>();
        private Edit edit;

        Pending(TreeNode oldNode, TreeNode newNode, List<TreeNode> covered, boolean moved) {
            this.oldNode = oldNode;
            this.newNode = newNode;
            this.covered = covered;
            this.moved = moved;
        }

        void complete() {
            List<Edit> built = new ArrayList<>(children.size());
            for (Pending child : children) {
                built.add(child.edit);
            }
            if (newNode == null) {
                edit = new Edit.Delete(oldNode, covered);
            } else if (oldNode == null) {
                edit = new Edit.Insert(newNode, covered, built);
            } else if (oldNode.sameContent(newNode)) {
                edit = new Edit.Copy(oldNode, newNode, moved, built);
            } else {
                edit = new Edit.Replace(oldNode, newNode, built);
            }
        }
    }
}
