package com.ai.studyengine.service;

import com.ai.studyengine.model.Flashcard;
import com.ai.studyengine.model.Question;
import com.ai.studyengine.model.StudySession;
import com.ai.studyengine.model.Topic;
import com.ai.studyengine.model.WorkflowStage;
import com.ai.studyengine.service.generation.GeneratedFlashcard;
import com.ai.studyengine.service.generation.GeneratedQuestion;
import com.ai.studyengine.service.generation.LeafContent;
import com.ai.studyengine.service.hierarchy.PrerequisiteGraph;
import com.ai.studyengine.service.hierarchy.TopicBlueprint;
import com.ai.studyengine.service.hierarchy.TopicTree;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps between identity-free {@link TopicTree}s and persistent topic
 * entities. Assembling always assigns fresh ids, so a cached tree can seed
 * any number of sessions.
 */
@Component
public class StudySessionAssembler {

    /**
     * Adds the topics of {@code tree} to {@code session}: pre-order
     * {@code orderIndex}, depth and sibling index, prerequisites as ids, the
     * first leaf open and every other leaf locked. Leaves that carry content
     * in the tree get it copied.
     *
     * @throws com.ai.studyengine.exception.PrerequisiteCycleException if the tree's prerequisites form a cycle
     */
    public void assemble(StudySession session, TopicTree tree) {
        List<TopicBlueprint> leafBlueprints = tree.leaves();
        Map<Integer, List<Integer>> requires = new HashMap<>();
        for (int i = 0; i < leafBlueprints.size(); i++) {
            requires.put(i, leafBlueprints.get(i).getPrerequisites());
        }
        PrerequisiteGraph.requireAcyclic(leafBlueprints.size(), requires, i -> leafBlueprints.get(i).getTitle());

        Map<TopicBlueprint, Topic> created = new IdentityHashMap<>();
        int[] order = {0};
        List<TopicBlueprint> roots = tree.getRoots();
        for (int i = 0; i < roots.size(); i++) {
            build(session, roots.get(i), null, 1, i, order, created);
        }

        List<Topic> leaves = leafBlueprints.stream().map(created::get).toList();
        for (int i = 0; i < leaves.size(); i++) {
            Topic leaf = leaves.get(i);
            leaf.setWorkflowStage(i == 0 ? WorkflowStage.QUIZ_AVAILABLE : WorkflowStage.LOCKED);
            if (i == 0)
                continue;
            for (Integer ordinal : leafBlueprints.get(i).getPrerequisites()) {
                if (ordinal != null && ordinal >= 0 && ordinal < leaves.size() && ordinal != i)
                    leaf.getPrerequisiteTopicIds().add(leaves.get(ordinal).getId());
            }
        }
    }

    private void build(StudySession session, TopicBlueprint blueprint, Topic parent, int depth, int siblingIndex,
                       int[] order, Map<TopicBlueprint, Topic> created) {
        Topic topic = Topic.builder()
                .id(UUID.randomUUID().toString())
                .title(blueprint.getTitle())
                .description(blueprint.getDescription())
                .category(blueprint.isCategory())
                .depth(depth)
                .siblingIndex(siblingIndex)
                .orderIndex(order[0]++)
                .positionX(blueprint.getPositionX())
                .positionY(blueprint.getPositionY())
                .build();
        session.addTopic(topic);
        if (parent != null)
            parent.addChild(topic);
        created.put(blueprint, topic);

        if (blueprint.isLeaf()) {
            if (!blueprint.getQuestions().isEmpty()) {
                applyContent(topic, LeafContent.builder()
                        .questions(blueprint.getQuestions())
                        .flashcards(blueprint.getFlashcards())
                        .build());
            }
            return;
        }
        List<TopicBlueprint> children = blueprint.getChildren();
        for (int i = 0; i < children.size(); i++) {
            build(session, children.get(i), topic, depth + 1, i, order, created);
        }
    }

    /** Attaches generated questions and fresh, never reviewed flashcards to a leaf. */
    public void applyContent(Topic leaf, LeafContent content) {
        for (GeneratedQuestion q : content.getQuestions()) {
            leaf.addQuestion(Question.builder()
                    .id(UUID.randomUUID().toString())
                    .text(q.getQuestion())
                    .options(new ArrayList<>(q.getOptions()))
                    .correctAnswer(q.getCorrectAnswer())
                    .explanation(q.getExplanation())
                    .sourceText(q.getSourceText())
                    .sourcePage(q.getSourcePage())
                    .build());
        }
        for (GeneratedFlashcard f : content.getFlashcards()) {
            leaf.addFlashcard(Flashcard.builder()
                    .id(UUID.randomUUID().toString())
                    .front(f.getFront())
                    .back(f.getBack())
                    .hint(f.getHint())
                    .build());
        }
    }

    /**
     * Identity-free copy of a session's tree and content, suitable for the
     * generation cache. Learner state is not included.
     */
    public TopicTree snapshot(StudySession session) {
        Map<String, Integer> leafOrdinal = new HashMap<>();
        List<Topic> leaves = session.leafTopics();
        for (int i = 0; i < leaves.size(); i++) {
            leafOrdinal.put(leaves.get(i).getId(), i);
        }
        return TopicTree.builder()
                .title(session.getTitle())
                .roots(session.rootTopics().stream().map(t -> toBlueprint(t, leafOrdinal)).toList())
                .build();
    }

    private TopicBlueprint toBlueprint(Topic topic, Map<String, Integer> leafOrdinal) {
        List<Integer> prerequisites = topic.getPrerequisiteTopicIds().stream()
                .map(leafOrdinal::get)
                .filter(o -> o != null)
                .sorted()
                .toList();
        return TopicBlueprint.builder()
                .title(topic.getTitle())
                .description(topic.getDescription())
                .category(topic.isCategory())
                .children(new ArrayList<>(topic.getChildren().stream().map(c -> toBlueprint(c, leafOrdinal)).toList()))
                .prerequisites(new ArrayList<>(prerequisites))
                .positionX(topic.getPositionX())
                .positionY(topic.getPositionY())
                .questions(new ArrayList<>(topic.getQuestions().stream().map(q -> GeneratedQuestion.builder()
                        .question(q.getText())
                        .options(new ArrayList<>(q.getOptions()))
                        .correctAnswer(q.getCorrectAnswer())
                        .explanation(q.getExplanation())
                        .sourceText(q.getSourceText())
                        .sourcePage(q.getSourcePage())
                        .build()).toList()))
                .flashcards(new ArrayList<>(topic.getFlashcards().stream().map(f -> GeneratedFlashcard.builder()
                        .front(f.getFront())
                        .back(f.getBack())
                        .hint(f.getHint())
                        .build()).toList()))
                .build();
    }
}
