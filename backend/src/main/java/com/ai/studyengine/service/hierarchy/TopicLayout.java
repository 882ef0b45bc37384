package com.ai.studyengine.service.hierarchy;

import java.util.List;

/**
 * Assigns skill-tree coordinates: leaves spread left to right in traversal
 * order, each category centred above its children, one row per depth.
 */
public final class TopicLayout {

    static final double COLUMN_WIDTH = 220.0;
    static final double ROW_HEIGHT = 160.0;

    private TopicLayout() {
    }

    public static void apply(TopicTree tree) {
        int[] nextColumn = {0};
        place(tree.getRoots(), 0, nextColumn);
    }

    private static void place(List<TopicBlueprint> nodes, int row, int[] nextColumn) {
        for (TopicBlueprint node : nodes) {
            node.setPositionY(row * ROW_HEIGHT);
            if (node.isLeaf() || node.getChildren().isEmpty()) {
                node.setPositionX(nextColumn[0]++ * COLUMN_WIDTH);
            } else {
                place(node.getChildren(), row + 1, nextColumn);
                double first = node.getChildren().get(0).getPositionX();
                double last = node.getChildren().get(node.getChildren().size() - 1).getPositionX();
                node.setPositionX((first + last) / 2);
            }
        }
    }
}
