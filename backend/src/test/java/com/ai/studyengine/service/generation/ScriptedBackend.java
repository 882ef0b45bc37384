package com.ai.studyengine.service.generation;

import com.ai.studyengine.client.BackendKind;
import com.ai.studyengine.client.BackendReply;
import com.ai.studyengine.client.GenerationBackend;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Backend that plays back queued replies and records the prompts it got.
 */
class ScriptedBackend implements GenerationBackend {

    private final BackendKind kind;
    private final boolean configured;
    private final boolean prefill;
    private final Deque<Object> script = new ArrayDeque<>();
    final List<String> prompts = new ArrayList<>();
    final List<String> prefills = new ArrayList<>();

    ScriptedBackend(BackendKind kind, boolean configured, boolean prefill) {
        this.kind = kind;
        this.configured = configured;
        this.prefill = prefill;
    }

    ScriptedBackend reply(String text) {
        script.add(BackendReply.builder().text(text).outputTokens(text.length() / 4).build());
        return this;
    }

    ScriptedBackend truncated(String text) {
        script.add(BackendReply.builder().text(text).truncated(true).build());
        return this;
    }

    ScriptedBackend fail(IOException e) {
        script.add(e);
        return this;
    }

    @Override
    public BackendKind kind() {
        return kind;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public boolean supportsPrefill() {
        return prefill;
    }

    @Override
    public BackendReply complete(String prompt, String prefill, int maxTokens) throws IOException {
        prompts.add(prompt);
        prefills.add(prefill);
        Object next = script.poll();
        if (next == null)
            throw new IOException(kind + " backend has no scripted reply left");
        if (next instanceof IOException)
            throw (IOException) next;
        return (BackendReply) next;
    }
}
