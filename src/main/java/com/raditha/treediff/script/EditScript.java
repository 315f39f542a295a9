package com.raditha.treediff.script;

import com.raditha.treediff.index.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, nested list of edits turning the old tree into the new one.
 */
public final class EditScript {

    private final List<Edit> edits;

    public EditScript(List<Edit> edits) {
        this.edits = List.copyOf(edits);
    }

    /**
     * Top-level edits.
     */
    public List<Edit> edits() {
        return edits;
    }

    /**
     * Every edit, parents before their children.
     */
    public List<Edit> flatten() {
        List<Edit> flat = new ArrayList<>();
        Deque<Edit> stack = new ArrayDeque<>();
        for (int i = edits.size() - 1; i >= 0; i--) {
            stack.push(edits.get(i));
        }
        while (!stack.isEmpty()) {
            Edit edit = stack.pop();
            flat.add(edit);
            List<Edit> children = edit.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return flat;
    }

    public long countOf(Class<? extends Edit> type) {
        return flatten().stream().filter(type::isInstance).count();
    }

    /**
     * How often each old node is covered by a Delete, Replace or Copy.
     */
    public Map<TreeNode, Integer> oldCoverage() {
        Map<TreeNode, Integer> coverage = new IdentityHashMap<>();
        for (Edit edit : flatten()) {
            if (edit instanceof Edit.Delete delete) {
                delete.covered().forEach(n -> coverage.merge(n, 1, Integer::sum));
            } else if (edit instanceof Edit.Replace replace) {
                coverage.merge(replace.oldNode(), 1, Integer::sum);
            } else if (edit instanceof Edit.Copy copy) {
                coverage.merge(copy.oldNode(), 1, Integer::sum);
            }
        }
        return coverage;
    }

    /**
     * How often each new node is covered by an Insert, Replace or Copy.
     */
    public Map<TreeNode, Integer> newCoverage() {
        Map<TreeNode, Integer> coverage = new IdentityHashMap<>();
        for (Edit edit : flatten()) {
            if (edit instanceof Edit.Insert insert) {
                insert.covered().forEach(n -> coverage.merge(n, 1, Integer::sum));
            } else if (edit instanceof Edit.Replace replace) {
                coverage.merge(replace.newNode(), 1, Integer::sum);
            } else if (edit instanceof Edit.Copy copy) {
                coverage.merge(copy.newNode(), 1, Integer::sum);
            }
        }
        return coverage;
    }

    /**
     * Check if the script only copies nodes in place.
     */
    public boolean isEmptyChange() {
        for (Edit edit : flatten()) {
            if (!(edit instanceof Edit.Copy copy) || copy.moved()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("EditScript[%d copies, %d replaces, %d inserts, %d deletes]",
                countOf(Edit.Copy.class), countOf(Edit.Replace.class),
                countOf(Edit.Insert.class), countOf(Edit.Delete.class));
    }
}
