package com.ai.studyengine.service;

import com.ai.studyengine.exception.PrerequisiteCycleException;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import com.ai.studyengine.service.generation.GeneratedFlashcard;
import com.ai.studyengine.service.generation.GeneratedQuestion;
import com.ai.studyengine.service.generation.LeafContent;
import com.ai.studyengine.service.hierarchy.HierarchyRepair;
import com.ai.studyengine.service.hierarchy.TopicBlueprint;
import com.ai.studyengine.service.hierarchy.TopicTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.ai.studyengine.StudyFixtures.proposal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StudySessionAssemblerTest {

    private final StudySessionAssembler assembler = new StudySessionAssembler();

    private TopicTree tree;

    @BeforeEach
    void setUp() {
        tree = new HierarchyRepair(3).repair(proposal(6), "Notes");
        tree.leaves().get(2).setPrerequisites(List.of(0, 1));
    }

    private static StudySession newSession() {
        return StudySession.builder().id("s1").title("Cell Biology").build();
    }

    private static LeafContent content(String stem) {
        return LeafContent.builder()
                .questions(List.of(GeneratedQuestion.builder()
                        .question(stem + "?")
                        .options(List.of("a", "b", "c", "d"))
                        .correctAnswer(2)
                        .explanation("c is right")
                        .build()))
                .flashcards(List.of(GeneratedFlashcard.builder().front(stem).back("meaning").build()))
                .build();
    }

    @Test
    void numbersTopicsInPreOrderWithDepthAndSiblingIndex() {
        StudySession session = newSession();
        assembler.assemble(session, tree);

        List<Topic> topics = session.getTopics();
        assertThat(topics).extracting(Topic::getOrderIndex).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertThat(topics).extracting(Topic::getDepth).containsExactly(1, 2, 2, 2, 2, 1, 2, 2);
        assertThat(topics).extracting(Topic::isCategory)
                .containsExactly(true, false, false, false, false, true, false, false);
        assertThat(topics.get(6).getSiblingIndex()).isEqualTo(0);
        assertThat(topics.get(7).getSiblingIndex()).isEqualTo(1);
        assertThat(topics.get(7).getParent()).isSameAs(topics.get(5));
        assertThat(topics.get(0).getWorkflowStage()).isNull();
    }

    @Test
    void opensOnlyTheFirstLeafAndMapsPrerequisitesToIds() {
        StudySession session = newSession();
        assembler.assemble(session, tree);

        List<Topic> leaves = session.leafTopics();
        assertThat(leaves).extracting(Topic::getWorkflowStage).containsExactly(
                WorkflowStage.QUIZ_AVAILABLE, WorkflowStage.LOCKED, WorkflowStage.LOCKED,
                WorkflowStage.LOCKED, WorkflowStage.LOCKED, WorkflowStage.LOCKED);
        assertThat(leaves.get(2).getPrerequisiteTopicIds())
                .containsExactly(leaves.get(0).getId(), leaves.get(1).getId());
    }

    @Test
    void everyAssemblyGetsFreshIds() {
        StudySession first = newSession();
        StudySession second = newSession();
        assembler.assemble(first, tree);
        assembler.assemble(second, tree);

        Set<String> ids = new HashSet<>();
        first.getTopics().forEach(t -> ids.add(t.getId()));
        second.getTopics().forEach(t -> ids.add(t.getId()));
        assertThat(ids).hasSize(16);
    }

    @Test
    void snapshotKeepsStructureContentAndPrerequisitesButNoIds() {
        StudySession session = newSession();
        assembler.assemble(session, tree);
        List<Topic> leaves = session.leafTopics();
        assembler.applyContent(leaves.get(0), content("Mitosis"));
        leaves.get(0).setScore(95);

        TopicTree snapshot = assembler.snapshot(session);

        List<TopicBlueprint> snapshotLeaves = snapshot.leaves();
        assertThat(snapshot.getTitle()).isEqualTo("Cell Biology");
        assertThat(snapshotLeaves).extracting(TopicBlueprint::getTitle)
                .containsExactlyElementsOf(tree.leaves().stream().map(TopicBlueprint::getTitle).toList());
        assertThat(snapshotLeaves.get(2).getPrerequisites()).containsExactly(0, 1);
        assertThat(snapshotLeaves.get(0).getQuestions()).extracting(GeneratedQuestion::getCorrectAnswer).containsExactly(2);
        assertThat(snapshotLeaves.get(0).getFlashcards()).extracting(GeneratedFlashcard::getFront).containsExactly("Mitosis");
        assertThat(snapshotLeaves.get(1).getQuestions()).isEmpty();
    }

    @Test
    void assemblingASnapshotCopiesContentWithFreshLearnerState() {
        StudySession original = newSession();
        assembler.assemble(original, tree);
        assembler.applyContent(original.leafTopics().get(0), content("Mitosis"));
        original.leafTopics().get(0).getFlashcards().get(0).setRepetitions(3);

        StudySession copy = newSession();
        assembler.assemble(copy, assembler.snapshot(original));

        Topic leaf = copy.leafTopics().get(0);
        assertThat(leaf.getQuestions()).hasSize(1);
        assertThat(leaf.getFlashcards()).hasSize(1);
        assertThat(leaf.getFlashcards().get(0).getRepetitions()).isZero();
        assertThat(leaf.getFlashcards().get(0).getId())
                .isNotEqualTo(original.leafTopics().get(0).getFlashcards().get(0).getId());
        assertThat(copy.leafTopics().get(1).needsContent()).isTrue();
    }

    @Test
    void rejectsCyclicPrerequisites() {
        tree.leaves().get(1).setPrerequisites(List.of(2));

        assertThatThrownBy(() -> assembler.assemble(newSession(), tree))
                .isInstanceOf(PrerequisiteCycleException.class)
                .hasMessageContaining("Mitosis");
    }
}
