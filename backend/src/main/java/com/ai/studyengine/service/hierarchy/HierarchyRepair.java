package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.exception.HierarchyValidationException;
import com.ai.studyengine.service.generation.TopicProposal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts an accepted proposal into a {@link TopicTree} that satisfies
 * every structural invariant, whatever the proposal's remaining issues:
 * <ul>
 *   <li>levels below the maximum depth are collapsed into their ancestor at that depth;</li>
 *   <li>later near-duplicate siblings are dropped;</li>
 *   <li>a category without children becomes a leaf;</li>
 *   <li>prerequisite titles are resolved to leaf ordinals, the first leaf's are cleared
 *   and cycles are broken by removing their closing edge.</li>
 * </ul>
 */
@Slf4j
@Component
public class HierarchyRepair {

    private final int maxDepth;

    public HierarchyRepair(@Value("${study.hierarchy.max-depth:3}") int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public TopicTree repair(TopicProposal proposal, String fallbackTitle) {
        Map<TopicProposal.Node, TopicBlueprint> leafOf = new IdentityHashMap<>();
        Map<String, TopicBlueprint> leafByTitle = new HashMap<>();

        TopicTree tree = TopicTree.builder()
                .title(proposal.getTitle() != null ? proposal.getTitle() : fallbackTitle)
                .roots(convertLevel(proposal.getCategories(), 1, leafOf, leafByTitle))
                .build();

        List<TopicBlueprint> leaves = tree.leaves();
        if (leaves.isEmpty()) {
            throw new HierarchyValidationException("Proposal contains no leaf topics", List.of());
        }

        resolvePrerequisites(leaves, leafOf, leafByTitle);
        TopicLayout.apply(tree);
        return tree;
    }

    private List<TopicBlueprint> convertLevel(List<TopicProposal.Node> siblings, int depth,
                                              Map<TopicProposal.Node, TopicBlueprint> leafOf,
                                              Map<String, TopicBlueprint> leafByTitle) {
        List<TopicBlueprint> result = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (TopicProposal.Node node : siblings) {
            if (!seen.add(TitleNormalizer.key(node.getTitle()))) {
                log.debug("Dropping duplicate sibling topic '{}'", node.getTitle());
                continue;
            }
            result.add(convert(node, depth, leafOf, leafByTitle));
        }
        return result;
    }

    private TopicBlueprint convert(TopicProposal.Node node, int depth,
                                   Map<TopicProposal.Node, TopicBlueprint> leafOf,
                                   Map<String, TopicBlueprint> leafByTitle) {
        if (!node.isLeaf() && depth < maxDepth) {
            List<TopicBlueprint> children = convertLevel(node.getSubtopics(), depth + 1, leafOf, leafByTitle);
            if (!children.isEmpty()) {
                return TopicBlueprint.builder()
                        .title(node.getTitle())
                        .description(node.getDescription())
                        .category(true)
                        .children(children)
                        .build();
            }
        }

        TopicBlueprint leaf = TopicBlueprint.builder()
                .title(node.getTitle())
                .description(node.getDescription())
                .category(false)
                .build();
        register(node, leaf, leafOf, leafByTitle);

        if (!node.isLeaf()) {
            List<String> collapsed = new ArrayList<>();
            collapseInto(node.getSubtopics(), leaf, collapsed, leafOf, leafByTitle);
            String covers = "Covers: " + String.join(", ", collapsed) + ".";
            leaf.setDescription(node.getDescription() == null || node.getDescription().isBlank()
                    ? covers : node.getDescription() + " " + covers);
            log.debug("Collapsed {} nested topic(s) into '{}'", collapsed.size(), node.getTitle());
        }
        return leaf;
    }

    private void collapseInto(List<TopicProposal.Node> nodes, TopicBlueprint leaf, List<String> titles,
                              Map<TopicProposal.Node, TopicBlueprint> leafOf,
                              Map<String, TopicBlueprint> leafByTitle) {
        for (TopicProposal.Node node : nodes) {
            titles.add(node.getTitle());
            register(node, leaf, leafOf, leafByTitle);
            collapseInto(node.getSubtopics(), leaf, titles, leafOf, leafByTitle);
        }
    }

    private void register(TopicProposal.Node node, TopicBlueprint leaf,
                          Map<TopicProposal.Node, TopicBlueprint> leafOf,
                          Map<String, TopicBlueprint> leafByTitle) {
        leafOf.put(node, leaf);
        leafByTitle.putIfAbsent(TitleNormalizer.key(node.getTitle()), leaf);
    }

    private void resolvePrerequisites(List<TopicBlueprint> leaves,
                                      Map<TopicProposal.Node, TopicBlueprint> leafOf,
                                      Map<String, TopicBlueprint> leafByTitle) {
        Map<TopicBlueprint, Integer> ordinal = new IdentityHashMap<>();
        for (int i = 0; i < leaves.size(); i++) {
            ordinal.put(leaves.get(i), i);
        }

        Map<Integer, List<Integer>> requires = new HashMap<>();
        for (Map.Entry<TopicProposal.Node, TopicBlueprint> entry : leafOf.entrySet()) {
            int from = ordinal.get(entry.getValue());
            for (String title : entry.getKey().getPrerequisites()) {
                TopicBlueprint target = leafByTitle.get(TitleNormalizer.key(title));
                if (target == null || target == entry.getValue())
                    continue;
                List<Integer> targets = requires.computeIfAbsent(from, k -> new ArrayList<>());
                int to = ordinal.get(target);
                if (!targets.contains(to))
                    targets.add(to);
            }
        }

        requires.remove(0);

        List<Integer> cycle;
        while (!(cycle = PrerequisiteGraph.findCycle(leaves.size(), requires)).isEmpty()) {
            int from = cycle.get(cycle.size() - 2);
            Integer to = cycle.get(cycle.size() - 1);
            log.warn("Breaking prerequisite cycle by removing '{}' -> '{}'",
                    leaves.get(from).getTitle(), leaves.get(to).getTitle());
            requires.get(from).remove(to);
        }

        for (Map.Entry<Integer, List<Integer>> entry : requires.entrySet()) {
            List<Integer> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(null);
            leaves.get(entry.getKey()).setPrerequisites(sorted);
        }
    }
}
