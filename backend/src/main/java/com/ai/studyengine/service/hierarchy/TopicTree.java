package com.ai.studyengine.service.hierarchy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A validated topic tree: depth bounded, siblings distinct, prerequisites
 * acyclic. Optionally carries generated content on its leaves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopicTree {

    private String title;

    @Builder.Default
    private List<TopicBlueprint> roots = new ArrayList<>();

    /** Leaves in pre-order traversal order; index = leaf ordinal. */
    @JsonIgnore
    public List<TopicBlueprint> leaves() {
        List<TopicBlueprint> leaves = new ArrayList<>();
        walk(node -> {
            if (node.isLeaf())
                leaves.add(node);
        });
        return leaves;
    }

    /** Visits every node in pre-order. */
    public void walk(Consumer<TopicBlueprint> visitor) {
        for (TopicBlueprint root : roots) {
            walk(root, visitor);
        }
    }

    private void walk(TopicBlueprint node, Consumer<TopicBlueprint> visitor) {
        visitor.accept(node);
        for (TopicBlueprint child : node.getChildren()) {
            walk(child, visitor);
        }
    }
}
