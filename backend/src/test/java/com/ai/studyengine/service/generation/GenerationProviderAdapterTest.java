package com.ai.studyengine.service.generation;

import com.ai.studyengine.client.BackendKind;
import com.ai.studyengine.exception.GenerationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static com.ai.studyengine.StudyFixtures.contentReply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationProviderAdapterTest {

    private ScriptedBackend fast;
    private ScriptedBackend bulk;
    private GenerationProviderAdapter adapter;

    private final ContentBatchSchema schema = new ContentBatchSchema(List.of("0"));
    private final GenerationPrompt prompt = GenerationPrompt.builder().text("Write questions").batchSize(1).build();

    @BeforeEach
    void setUp() {
        fast = new ScriptedBackend(BackendKind.FAST, true, true);
        bulk = new ScriptedBackend(BackendKind.BULK, true, false);
        adapter = adapterFor(fast, bulk);
    }

    private static GenerationProviderAdapter adapterFor(ScriptedBackend... backends) {
        return new GenerationProviderAdapter(new BackendSelectionPolicy(List.of(backends), false),
                new JsonResponseRepair(new ObjectMapper()), 8192);
    }

    private static String validReply() {
        return contentReply(1, 2, 2).toString();
    }

    @Test
    void returnsTheFirstSchemaValidReply() {
        fast.reply(validReply());

        ContentBatch batch = adapter.generate(prompt, GenerationPhase.INITIAL, schema);

        assertThat(batch.questionCount()).isEqualTo(2);
        assertThat(batch.flashcardCount()).isEqualTo(2);
        assertThat(fast.prompts).containsExactly("Write questions");
        assertThat(fast.prefills).containsExactly(JsonResponseRepair.PREFILL);
        assertThat(bulk.prompts).isEmpty();
    }

    @Test
    void retriesWithStricterFormatRulesAfterUnparseableReply() {
        fast.reply("Sure! Here are some questions about cells.").reply(validReply());

        adapter.generate(prompt, GenerationPhase.INITIAL, schema);

        assertThat(fast.prompts).hasSize(2);
        assertThat(fast.prompts.get(1)).isEqualTo("Write questions" + GenerationProviderAdapter.STRICT_FORMAT_RULES);
    }

    @Test
    void treatsTruncatedRepliesAsFailuresAndMovesToTheOtherBackend() {
        fast.truncated(validReply()).fail(new IOException("HTTP 529"));
        bulk.reply(validReply());

        ContentBatch batch = adapter.generate(prompt, GenerationPhase.INITIAL, schema);

        assertThat(batch.get("0").getQuestions()).hasSize(2);
        assertThat(bulk.prefills).containsExactly((String) null);
        assertThat(bulk.prompts.get(0)).endsWith(GenerationProviderAdapter.STRICT_FORMAT_RULES);
    }

    @Test
    void failsAfterTheWholePlanWithTheAttemptCount() {
        fast.reply("{}").reply("{}");
        bulk.reply("{\"subtopics\": {}}");

        assertThatThrownBy(() -> adapter.generate(prompt, GenerationPhase.INITIAL, schema))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("content-batch generation failed after 3 attempt(s)")
                .hasMessageContaining("Missing content for topic key '0'")
                .extracting(e -> ((GenerationException) e).getAttempts())
                .isEqualTo(3);
    }

    @Test
    void incrementalBatchesNeverReachTheFastBackendByDefault() {
        bulk.reply("garbage").reply("more garbage");

        assertThatThrownBy(() -> adapter.generate(prompt, GenerationPhase.INCREMENTAL, schema))
                .isInstanceOf(GenerationException.class);
        assertThat(fast.prompts).isEmpty();
        assertThat(bulk.prompts).hasSize(2);
    }

    @Test
    void failsFastWithoutAnyConfiguredBackend() {
        GenerationProviderAdapter unconfigured = adapterFor(
                new ScriptedBackend(BackendKind.FAST, false, true),
                new ScriptedBackend(BackendKind.BULK, false, false));

        assertThatThrownBy(() -> unconfigured.generate(prompt, GenerationPhase.INITIAL, schema))
                .isInstanceOf(GenerationException.class)
                .hasMessageStartingWith("No generation backend is configured");
    }
}
