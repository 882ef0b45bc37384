package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.exception.PrerequisiteCycleException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrerequisiteGraphTest {

    @Test
    void chainIsAcyclic() {
        assertThat(PrerequisiteGraph.findCycle(4, Map.of(1, List.of(0), 2, List.of(1), 3, List.of(0, 2)))).isEmpty();
    }

    @Test
    void reportsCycleInTraversalOrderWithFirstNodeRepeated() {
        List<Integer> cycle = PrerequisiteGraph.findCycle(4, Map.of(1, List.of(2), 2, List.of(3), 3, List.of(1)));

        assertThat(cycle).containsExactly(1, 2, 3, 1);
    }

    @Test
    void selfReferenceIsACycle() {
        assertThat(PrerequisiteGraph.findCycle(2, Map.of(1, List.of(1)))).containsExactly(1, 1);
    }

    @Test
    void leavesWithoutEdgesAreSkipped() {
        Map<Integer, ArrayList<Integer>> requires = new HashMap<>();
        requires.put(2, new ArrayList<>(List.of(0)));
        requires.put(4, new ArrayList<>(List.of(3, 2)));

        assertThat(PrerequisiteGraph.findCycle(5, requires)).isEmpty();

        requires.put(0, new ArrayList<>(List.of(4)));
        assertThat(PrerequisiteGraph.findCycle(5, requires)).containsExactly(0, 4, 2, 0);
    }

    @Test
    void ignoresOutOfRangeOrdinals() {
        assertThat(PrerequisiteGraph.findCycle(2, Map.of(1, List.of(7, -1)))).isEmpty();
    }

    @Test
    void requireAcyclicNamesTheTopicsOnTheCycle() {
        List<String> titles = List.of("Atoms", "Bonds", "Molecules");

        assertThatThrownBy(() -> PrerequisiteGraph.requireAcyclic(3,
                Map.of(1, List.of(2), 2, List.of(1)), titles::get))
                .isInstanceOf(PrerequisiteCycleException.class)
                .hasMessage("Prerequisite cycle: Bonds -> Molecules -> Bonds");
    }
}
