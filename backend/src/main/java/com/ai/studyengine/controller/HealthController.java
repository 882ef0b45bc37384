package com.ai.studyengine.controller;

import com.ai.studyengine.client.BackendKind;
import com.ai.studyengine.service.generation.BackendSelectionPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final BackendSelectionPolicy backendSelectionPolicy;

    // ── GET /api/health ──────────────────────────────────────────────────────

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "Study Engine",
                "backends", Map.of(
                        "fast", backendSelectionPolicy.isUsable(BackendKind.FAST),
                        "bulk", backendSelectionPolicy.isUsable(BackendKind.BULK))));
    }
}
