package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.exception.HierarchyValidationException;
import com.ai.studyengine.service.generation.TopicProposal;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ai.studyengine.StudyFixtures.category;
import static com.ai.studyengine.StudyFixtures.leaf;
import static com.ai.studyengine.StudyFixtures.proposal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyRepairTest {

    private final HierarchyRepair repair = new HierarchyRepair(3);

    private static TopicProposal of(TopicProposal.Node... categories) {
        return TopicProposal.builder().categories(new ArrayList<>(List.of(categories))).build();
    }

    @Test
    void collapsesLevelsBelowMaximumDepthIntoALeaf() {
        TopicProposal deep = of(category("Biology",
                category("Cells",
                        category("Organelles", leaf("Mitochondria"), leaf("Ribosomes")))));

        TopicTree tree = repair.repair(deep, "Notes");

        List<TopicBlueprint> leaves = tree.leaves();
        assertThat(leaves).hasSize(1);
        assertThat(leaves.get(0).getTitle()).isEqualTo("Organelles");
        assertThat(leaves.get(0).getDescription()).endsWith("Covers: Mitochondria, Ribosomes.");
        assertThat(tree.getRoots().get(0).getChildren().get(0).getChildren()).containsExactly(leaves.get(0));
    }

    @Test
    void dropsLaterNearDuplicateSiblings() {
        TopicTree tree = repair.repair(of(category("Energy",
                leaf("Cellular Respiration"),
                leaf("Respiration (Cellular)"),
                leaf("Fermentation"))), "Notes");

        assertThat(tree.leaves()).extracting(TopicBlueprint::getTitle)
                .containsExactly("Cellular Respiration", "Fermentation");
    }

    @Test
    void resolvesPrerequisiteTitlesAndClearsTheFirstLeaf() {
        TopicProposal.Node a = leaf("Glycolysis");
        TopicProposal.Node b = leaf("Krebs Cycle");
        TopicProposal.Node c = leaf("Electron Transport");
        a.getPrerequisites().add("Electron Transport");
        c.getPrerequisites().addAll(List.of("krebs cycle", "Unknown Topic"));

        List<TopicBlueprint> leaves = repair.repair(of(category("Respiration", a, b, c)), "Notes").leaves();

        assertThat(leaves.get(0).getPrerequisites()).isEmpty();
        assertThat(leaves.get(1).getPrerequisites()).isEmpty();
        assertThat(leaves.get(2).getPrerequisites()).containsExactly(1);
    }

    @Test
    void breaksPrerequisiteCyclesByRemovingTheClosingEdge() {
        TopicProposal.Node a = leaf("Glycolysis");
        TopicProposal.Node b = leaf("Krebs Cycle");
        TopicProposal.Node c = leaf("Electron Transport");
        b.getPrerequisites().add("Electron Transport");
        c.getPrerequisites().add("Krebs Cycle");

        List<TopicBlueprint> leaves = repair.repair(of(category("Respiration", a, b, c)), "Notes").leaves();

        assertThat(leaves.get(1).getPrerequisites()).containsExactly(2);
        assertThat(leaves.get(2).getPrerequisites()).isEmpty();
    }

    @Test
    void rejectsAProposalWithoutLeaves() {
        assertThatThrownBy(() -> repair.repair(of(), "Notes"))
                .isInstanceOf(HierarchyValidationException.class)
                .hasMessageContaining("no leaf topics");
    }

    @Test
    void usesTheFallbackTitleWhenNoneWasProposed() {
        TopicProposal proposal = proposal(2);
        proposal.setTitle(null);

        assertThat(repair.repair(proposal, "Lecture 4").getTitle()).isEqualTo("Lecture 4");
    }

    @Test
    void laysLeavesOutInColumnsWithCategoriesCentredAbove() {
        TopicTree tree = repair.repair(proposal(6), "Notes");

        assertThat(tree.leaves()).extracting(TopicBlueprint::getPositionX)
                .containsExactly(0.0, 220.0, 440.0, 660.0, 880.0, 1100.0);
        assertThat(tree.leaves()).extracting(TopicBlueprint::getPositionY).containsOnly(160.0);
        assertThat(tree.getRoots()).extracting(TopicBlueprint::getPositionX).containsExactly(330.0, 990.0);
        assertThat(tree.getRoots()).extracting(TopicBlueprint::getPositionY).containsOnly(0.0);
    }
}
