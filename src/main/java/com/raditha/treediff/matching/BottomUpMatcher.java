package com.raditha.treediff.matching;

import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Picks up what the top-down pass left behind.
 * <p>
 * Small unmapped subtrees are matched by exact content: candidates are
 * looked up in parallel, then applied one by one in old pre-order so a node
 * is never mapped twice. Afterwards unmapped old containers whose mapped
 * children mostly land under one unmapped new node are recovered.
 */
final class BottomUpMatcher {

    private final MatchContext context;
    private final ChildProposer proposer;

    BottomUpMatcher(MatchContext context, ChildProposer proposer) {
        this.context = context;
        this.proposer = proposer;
    }

    void matchIdentical() {
        Mapping mapping = context.mapping();
        int limit = context.config().smallNodeSize();

        Map<Integer, List<TreeNode>> newByHash = new HashMap<>();
        for (TreeNode newNode : mapping.newTree().nodes()) {
            if (newNode.size() <= limit && !mapping.isNewMapped(newNode)) {
                newByHash.computeIfAbsent(newNode.subtreeHash(), h -> new ArrayList<>()).add(newNode);
            }
        }
        if (newByHash.isEmpty()) {
            return;
        }

        List<TreeNode> olds = new ArrayList<>();
        for (TreeNode oldNode : mapping.oldTree().nodes()) {
            if (oldNode.size() <= limit && !mapping.isOldMapped(oldNode)) {
                olds.add(oldNode);
            }
        }

        // Lookups only read the immutable indexes
        List<Proposal> proposals = olds.parallelStream()
                .map(oldNode -> new Proposal(oldNode, identicalCandidates(oldNode, newByHash)))
                .filter(p -> !p.candidates().isEmpty())
                .collect(Collectors.toList());

        for (Proposal proposal : proposals) {
            TreeNode oldNode = proposal.oldNode();
            if (mapping.isOldMapped(oldNode)) {
                continue;
            }
            for (TreeNode newNode : proposal.candidates()) {
                if (context.canPair(oldNode, newNode)) {
                    mapIdentical(oldNode, newNode);
                    break;
                }
            }
        }
    }

    private static List<TreeNode> identicalCandidates(TreeNode oldNode, Map<Integer, List<TreeNode>> newByHash) {
        List<TreeNode> sameHash = newByHash.getOrDefault(oldNode.subtreeHash(), List.of());
        List<TreeNode> identical = new ArrayList<>();
        for (TreeNode newNode : sameHash) {
            if (oldNode.sameSubtreeContent(newNode)) {
                identical.add(newNode);
            }
        }
        identical.sort(Comparator
                .comparingDouble((TreeNode n) -> Math.abs(n.relativePosition() - oldNode.relativePosition()))
                .thenComparingInt(TreeNode::index));
        return identical;
    }

    /**
     * Map two identical subtrees node by node, skipping pairs that are no
     * longer free.
     */
    private void mapIdentical(TreeNode oldNode, TreeNode newNode) {
        TreeIndex oldTree = oldNode.tree();
        TreeIndex newTree = newNode.tree();
        for (int k = 0; k < oldNode.size(); k++) {
            TreeNode o = oldTree.get(oldNode.index() + k);
            TreeNode n = newTree.get(newNode.index() + k);
            if (context.canPair(o, n)) {
                context.mapping().put(o, n);
                context.bottomUp++;
            }
        }
    }

    /**
     * Map unmapped old inner nodes to the unmapped new node that holds most
     * of their mapped children. Runs children before parents so a recovered
     * node can vote for its own parent.
     */
    void recoverContainers() {
        Mapping mapping = context.mapping();
        List<TreeNode> olds = mapping.oldTree().nodes();
        double ratio = context.config().recoveryRatio();

        for (int i = olds.size() - 1; i >= 0; i--) {
            TreeNode oldNode = olds.get(i);
            if (oldNode.isLeaf() || mapping.isOldMapped(oldNode)) {
                continue;
            }
            Map<TreeNode, Integer> votes = new LinkedHashMap<>();
            for (TreeNode child : oldNode.children()) {
                TreeNode partner = mapping.newFor(child);
                if (partner == null || partner.parent() == null) {
                    continue;
                }
                TreeNode container = partner.parent();
                if (!mapping.isNewMapped(container) && context.categoryFilter().shouldCompare(oldNode, container)) {
                    votes.merge(container, 1, Integer::sum);
                }
            }
            TreeNode best = null;
            int bestVotes = 0;
            for (Map.Entry<TreeNode, Integer> vote : votes.entrySet()) {
                if (vote.getValue() > bestVotes
                        || (vote.getValue() == bestVotes && best != null && vote.getKey().index() < best.index())) {
                    best = vote.getKey();
                    bestVotes = vote.getValue();
                }
            }
            if (best != null && (double) bestVotes / oldNode.children().size() >= ratio - 1e-9) {
                mapping.put(oldNode, best);
                context.recovered++;
                proposer.propagate(oldNode, best);
            }
        }
    }

    private record Proposal(TreeNode oldNode, List<TreeNode> candidates) {
    }
}
