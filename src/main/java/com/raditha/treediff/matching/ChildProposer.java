package com.raditha.treediff.matching;

import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.model.Syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Once two nodes are matched, proposes their children pairwise and follows
 * accepted pairs downwards.
 * <p>
 * Fixed shapes of the same variant and arity pair by position, keyed shapes
 * by key, and everything else through the {@link SiblingAligner}. A proposed
 * pair is accepted only if both nodes are still free, the category filter
 * allows it, and the subtrees are identical or within the distance
 * threshold.
 */
final class ChildProposer {

    private final MatchContext context;
    private final SiblingAligner aligner;

    ChildProposer(MatchContext context) {
        this.context = context;
        this.aligner = new SiblingAligner(context);
    }

    /**
     * Propagate a freshly accepted pair to its descendants.
     *
     * @return number of descendant pairs added
     */
    int propagate(TreeNode oldNode, TreeNode newNode) {
        int added = 0;
        Deque<Mapping.Pair> work = new ArrayDeque<>();
        work.push(new Mapping.Pair(oldNode, newNode));
        while (!work.isEmpty()) {
            Mapping.Pair pair = work.pop();
            for (Mapping.Pair child : proposals(pair.oldNode(), pair.newNode())) {
                if (!context.mapping().isFree(child.oldNode(), child.newNode())) {
                    continue;
                }
                context.mapping().put(child.oldNode(), child.newNode());
                added++;
                work.push(child);
            }
        }
        context.propagated += added;
        return added;
    }

    private List<Mapping.Pair> proposals(TreeNode oldNode, TreeNode newNode) {
        if (oldNode.isLeaf() || newNode.isLeaf()) {
            return List.of();
        }
        PairingStrategy strategy = oldNode.kind() == newNode.kind()
                ? PairingStrategy.of(oldNode.term().syntax())
                : PairingStrategy.ALIGNED;

        return switch (strategy) {
            case POSITIONAL -> oldNode.children().size() == newNode.children().size()
                    ? byPosition(oldNode, newNode)
                    : aligner.align(oldNode.children(), newNode.children());
            case KEYED -> byKey(oldNode, newNode);
            case ALIGNED -> aligner.align(oldNode.children(), newNode.children());
            case NONE -> List.of();
        };
    }

    private List<Mapping.Pair> byPosition(TreeNode oldNode, TreeNode newNode) {
        List<Mapping.Pair> pairs = new ArrayList<>();
        List<TreeNode> olds = oldNode.children();
        List<TreeNode> news = newNode.children();
        for (int i = 0; i < olds.size(); i++) {
            if (context.acceptable(olds.get(i), news.get(i))) {
                pairs.add(new Mapping.Pair(olds.get(i), news.get(i)));
            }
        }
        return pairs;
    }

    private List<Mapping.Pair> byKey(TreeNode oldNode, TreeNode newNode) {
        List<String> oldKeys = ((Syntax.Keyed) oldNode.term().syntax()).keys();
        List<String> newKeys = ((Syntax.Keyed) newNode.term().syntax()).keys();

        Map<String, TreeNode> oldByKey = new HashMap<>();
        for (int i = 0; i < oldKeys.size(); i++) {
            oldByKey.put(oldKeys.get(i), oldNode.children().get(i));
        }

        List<Mapping.Pair> pairs = new ArrayList<>();
        List<TreeNode> unkeyedOld = new ArrayList<>(oldNode.children());
        List<TreeNode> unkeyedNew = new ArrayList<>();
        for (int i = 0; i < newKeys.size(); i++) {
            TreeNode newChild = newNode.children().get(i);
            TreeNode oldChild = oldByKey.get(newKeys.get(i));
            if (oldChild != null && context.acceptable(oldChild, newChild)) {
                pairs.add(new Mapping.Pair(oldChild, newChild));
                unkeyedOld.remove(oldChild);
            } else {
                unkeyedNew.add(newChild);
            }
        }
        // Renamed keys: fall back to best match among the rest
        pairs.addAll(aligner.align(unkeyedOld, unkeyedNew));
        return pairs;
    }
}
