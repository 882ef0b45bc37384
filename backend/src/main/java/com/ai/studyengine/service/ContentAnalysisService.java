package com.ai.studyengine.service;

import com.ai.studyengine.dto.ContentAnalysisResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Estimates the size and density of study material and recommends how many
 * topics and questions per topic to generate.
 *
 * <p>Complexity is a weighted mix of vocabulary richness (40%), average word
 * length (30%) and average sentence length (30%), capped at 1.0.</p>
 */
@Slf4j
@Service
public class ContentAnalysisService {

    private static final int WORDS_PER_MINUTE = 225;
    private static final int MAX_TOPICS = 35;
    private static final int MIN_QUESTIONS = 10;
    private static final int MAX_QUESTIONS = 100;

    public ContentAnalysisResponse analyze(String text) {
        String[] words = text == null || text.isBlank() ? new String[0] : text.strip().split("\\s+");
        int wordCount = words.length;

        Set<String> unique = new HashSet<>();
        long totalLength = 0;
        for (String word : words) {
            totalLength += word.length();
            if (isAlphanumeric(word))
                unique.add(word.toLowerCase(Locale.ROOT));
        }
        double uniqueWordRatio = (double) unique.size() / Math.max(wordCount, 1);
        double avgWordLength = (double) totalLength / Math.max(wordCount, 1);

        long sentences = text == null ? 0 : text.chars().filter(c -> c == '.' || c == '!' || c == '?').count();
        double avgSentenceLength = (double) wordCount / Math.max(sentences, 1);

        double complexity = Math.min(1.0,
                uniqueWordRatio * 0.4
                        + Math.min(avgWordLength / 8, 1.0) * 0.3
                        + Math.min(avgSentenceLength / 25, 1.0) * 0.3);

        int topics = (int) Math.max(1, Math.min(MAX_TOPICS, Math.round(baseTopics(wordCount) * (0.8 + complexity * 0.4))));
        int questions = (int) Math.max(MIN_QUESTIONS,
                Math.min(MAX_QUESTIONS, Math.round(baseQuestions(wordCount) * (0.9 + complexity * 0.6))));

        ContentAnalysisResponse analysis = ContentAnalysisResponse.builder()
                .wordCount(wordCount)
                .estimatedReadingTime((int) Math.max(1, Math.round((double) wordCount / WORDS_PER_MINUTE)))
                .recommendedTopics(topics)
                .recommendedQuestions(questions)
                .complexityScore(round(complexity, 100))
                .uniqueWordRatio(round(uniqueWordRatio, 100))
                .avgWordLength(round(avgWordLength, 10))
                .avgSentenceLength(round(avgSentenceLength, 10))
                .build();

        log.debug("Content analysis: words={}, complexity={}, topics={}, questions={}",
                wordCount, analysis.getComplexityScore(), topics, questions);
        return analysis;
    }

    private int baseTopics(int wordCount) {
        if (wordCount < 100)
            return 1;
        if (wordCount < 500)
            return 2;
        if (wordCount < 2000)
            return 4;
        if (wordCount < 5000)
            return 8;
        if (wordCount < 10000)
            return 12;
        if (wordCount < 20000)
            return 20;
        return 30;
    }

    private int baseQuestions(int wordCount) {
        if (wordCount < 1000)
            return 15;
        if (wordCount < 3000)
            return 20;
        if (wordCount < 10000)
            return 25;
        return 30;
    }

    private boolean isAlphanumeric(String word) {
        return !word.isEmpty() && word.chars().allMatch(Character::isLetterOrDigit);
    }

    private double round(double value, int scale) {
        return Math.round(value * scale) / (double) scale;
    }
}
