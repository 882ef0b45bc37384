package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.service.generation.TopicProposal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a raw topic proposal against the structural rules of a topic tree.
 * Reports issues instead of throwing so the caller can re-prompt or keep
 * the least bad proposal.
 */
@Component
public class HierarchyValidator {

    private final int maxDepth;
    private final int minLeafTitleChars;
    private final int minLeafDescriptionChars;

    public HierarchyValidator(@Value("${study.hierarchy.max-depth:3}") int maxDepth,
                              @Value("${study.hierarchy.min-leaf-title-chars:4}") int minLeafTitleChars,
                              @Value("${study.hierarchy.min-leaf-description-chars:12}") int minLeafDescriptionChars) {
        this.maxDepth = maxDepth;
        this.minLeafTitleChars = minLeafTitleChars;
        this.minLeafDescriptionChars = minLeafDescriptionChars;
    }

    public List<HierarchyIssue> validate(TopicProposal proposal) {
        List<HierarchyIssue> issues = new ArrayList<>();
        checkLevel(proposal.getCategories(), 1, "", issues);
        checkPrerequisites(proposal, issues);
        return issues;
    }

    /**
     * Heuristic: a leaf needs a non-trivial title and a real description to
     * carry a full question set.
     */
    public boolean isQuestionWorthy(TopicProposal.Node leaf) {
        String title = leaf.getTitle() == null ? "" : leaf.getTitle().strip();
        String description = leaf.getDescription() == null ? "" : leaf.getDescription().strip();
        return title.length() >= minLeafTitleChars
                && title.chars().anyMatch(Character::isLetter)
                && description.length() >= minLeafDescriptionChars;
    }

    private void checkLevel(List<TopicProposal.Node> siblings, int depth, String path, List<HierarchyIssue> issues) {
        Map<String, String> seen = new HashMap<>();
        for (TopicProposal.Node node : siblings) {
            String here = path.isEmpty() ? node.getTitle() : path + " > " + node.getTitle();

            String previous = seen.putIfAbsent(TitleNormalizer.key(node.getTitle()), node.getTitle());
            if (previous != null) {
                issues.add(HierarchyIssue.of(HierarchyIssue.Kind.DUPLICATE_SIBLINGS,
                        "'" + previous + "' and '" + node.getTitle() + "' are duplicates under "
                                + (path.isEmpty() ? "the top level" : "'" + path + "'")));
            }

            if (node.isLeaf()) {
                if (!isQuestionWorthy(node)) {
                    issues.add(HierarchyIssue.of(HierarchyIssue.Kind.UNWORTHY_LEAF,
                            "'" + here + "' is too narrow or has no description"));
                }
            } else if (depth >= maxDepth) {
                issues.add(HierarchyIssue.of(HierarchyIssue.Kind.DEPTH_EXCEEDED,
                        "'" + here + "' nests deeper than " + maxDepth + " levels"));
            } else {
                checkLevel(node.getSubtopics(), depth + 1, here, issues);
            }
        }
    }

    private void checkPrerequisites(TopicProposal proposal, List<HierarchyIssue> issues) {
        List<TopicProposal.Node> leaves = leavesOf(proposal);
        Map<String, Integer> ordinalByKey = new HashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            ordinalByKey.putIfAbsent(TitleNormalizer.key(leaves.get(i).getTitle()), i);
        }

        Map<Integer, List<Integer>> requires = new HashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            List<Integer> targets = new ArrayList<>();
            for (String title : leaves.get(i).getPrerequisites()) {
                Integer target = ordinalByKey.get(TitleNormalizer.key(title));
                if (target != null)
                    targets.add(target);
            }
            requires.put(i, targets);
        }

        if (!leaves.isEmpty() && !requires.get(0).isEmpty()) {
            issues.add(HierarchyIssue.of(HierarchyIssue.Kind.FIRST_LEAF_PREREQUISITE,
                    "the first leaf '" + leaves.get(0).getTitle() + "' must not have prerequisites"));
        }

        List<Integer> cycle = PrerequisiteGraph.findCycle(leaves.size(), requires);
        if (!cycle.isEmpty()) {
            issues.add(HierarchyIssue.of(HierarchyIssue.Kind.PREREQUISITE_CYCLE,
                    "prerequisites form a cycle: " + String.join(" -> ",
                            cycle.stream().map(i -> leaves.get(i).getTitle()).toList())));
        }
    }

    /** Leaves of the proposal in pre-order, regardless of depth. */
    static List<TopicProposal.Node> leavesOf(TopicProposal proposal) {
        List<TopicProposal.Node> leaves = new ArrayList<>();
        collectLeaves(proposal.getCategories(), leaves);
        return leaves;
    }

    private static void collectLeaves(List<TopicProposal.Node> nodes, List<TopicProposal.Node> into) {
        for (TopicProposal.Node node : nodes) {
            if (node.isLeaf()) {
                into.add(node);
            } else {
                collectLeaves(node.getSubtopics(), into);
            }
        }
    }
}
