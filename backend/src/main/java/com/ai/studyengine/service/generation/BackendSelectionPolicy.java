package com.ai.studyengine.service.generation;

import com.ai.studyengine.client.BackendKind;
import com.ai.studyengine.client.GenerationBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which backends a request may use and in which order.
 *
 * <ul>
 *   <li>INITIAL: fast backend, one strict retry on it, then the bulk backend.</li>
 *   <li>INCREMENTAL: bulk backend and one strict retry on it. The fast backend
 *   is only used when the bulk one is not configured, or as a last resort
 *   when {@code study.generation.incremental-fast-failover} is on.</li>
 * </ul>
 *
 * Backends without credentials are left out of every plan.
 */
@Slf4j
@Component
public class BackendSelectionPolicy {

    private final Map<BackendKind, GenerationBackend> backends = new EnumMap<>(BackendKind.class);
    private final boolean incrementalFastFailover;

    public BackendSelectionPolicy(List<GenerationBackend> available,
                                  @Value("${study.generation.incremental-fast-failover:false}")
                                  boolean incrementalFastFailover) {
        for (GenerationBackend backend : available) {
            backends.put(backend.kind(), backend);
        }
        this.incrementalFastFailover = incrementalFastFailover;
    }

    public List<BackendAttempt> plan(GenerationPhase phase) {
        BackendKind primary = phase == GenerationPhase.INITIAL ? BackendKind.FAST : BackendKind.BULK;
        boolean crossBackend = phase == GenerationPhase.INITIAL || incrementalFastFailover;

        if (!isUsable(primary)) {
            log.debug("{} backend not configured; {} requests fall back to {}", primary, phase, primary.other());
            primary = primary.other();
            crossBackend = false;
        }

        List<BackendAttempt> plan = new ArrayList<>(3);
        if (isUsable(primary)) {
            plan.add(new BackendAttempt(backends.get(primary), false));
            plan.add(new BackendAttempt(backends.get(primary), true));
        }
        if (crossBackend && isUsable(primary.other())) {
            plan.add(new BackendAttempt(backends.get(primary.other()), true));
        }
        return plan;
    }

    public boolean isUsable(BackendKind kind) {
        GenerationBackend backend = backends.get(kind);
        return backend != null && backend.isConfigured();
    }
}
