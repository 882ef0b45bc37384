package com.ai.studyengine.service.hierarchy;

import com.ai.studyengine.dto.ContentAnalysisResponse;
import com.ai.studyengine.exception.GenerationException;
import com.ai.studyengine.service.generation.GenerationPhase;
import com.ai.studyengine.service.generation.GenerationPrompt;
import com.ai.studyengine.service.generation.GenerationPrompts;
import com.ai.studyengine.service.generation.GenerationProviderAdapter;
import com.ai.studyengine.service.generation.TopicProposal;
import com.ai.studyengine.service.generation.TopicProposalSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Requests a topic hierarchy for a document and turns it into a validated
 * {@link TopicTree}.
 *
 * <p>A proposal that breaks the rules is re-requested with a stricter
 * prompt listing its problems. Once the retry budget is spent the proposal
 * with the fewest issues is accepted and repaired, with a quality warning
 * in the log. Session creation never fails on hierarchy quality alone.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicHierarchyBuilder {

    private final GenerationProviderAdapter generationProviderAdapter;
    private final GenerationPrompts generationPrompts;
    private final TopicProposalSchema topicProposalSchema;
    private final HierarchyValidator hierarchyValidator;
    private final HierarchyRepair hierarchyRepair;

    @Value("${study.hierarchy.max-retries:1}")
    private int maxRetries;

    @Value("${study.hierarchy.max-depth:3}")
    private int maxDepth;

    @Value("${study.hierarchy.max-tokens:4096}")
    private int maxTokens;

    /**
     * @param leafCount     target number of leaf topics
     * @param fallbackTitle session title used when the backend suggests none
     * @throws GenerationException when not even one proposal could be obtained
     */
    public TopicTree build(String sourceText, ContentAnalysisResponse analysis, int leafCount, String fallbackTitle) {
        TopicProposal best = null;
        List<HierarchyIssue> bestIssues = List.of();
        List<String> feedback = List.of();
        int attempts = 0;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            TopicProposal proposal;
            try {
                proposal = generationProviderAdapter.generate(GenerationPrompt.builder()
                                .text(generationPrompts.topicProposalPrompt(sourceText, analysis, leafCount, maxDepth, feedback))
                                .batchSize(leafCount)
                                .maxTokens(maxTokens)
                                .build(),
                        GenerationPhase.INITIAL, topicProposalSchema);
            } catch (GenerationException e) {
                if (best == null)
                    throw e;
                log.warn("Topic hierarchy re-request failed, keeping earlier proposal: {}", e.getMessage());
                break;
            }
            attempts++;

            List<HierarchyIssue> issues = hierarchyValidator.validate(proposal);
            if (best == null || issues.size() < bestIssues.size()) {
                best = proposal;
                bestIssues = issues;
            }
            if (issues.isEmpty())
                break;

            log.info("Topic hierarchy rejected on attempt {} with {} issue(s): {}", attempts, issues.size(), issues);
            feedback = issues.stream().map(HierarchyIssue::getDetail).toList();
        }

        if (!bestIssues.isEmpty()) {
            log.warn("Accepting topic hierarchy with {} quality issue(s) after {} attempt(s): {}",
                    bestIssues.size(), attempts, bestIssues);
        }

        TopicTree tree = hierarchyRepair.repair(best, fallbackTitle);
        log.info("Topic hierarchy built: title='{}', roots={}, leaves={}",
                tree.getTitle(), tree.getRoots().size(), tree.leaves().size());
        return tree;
    }
}
