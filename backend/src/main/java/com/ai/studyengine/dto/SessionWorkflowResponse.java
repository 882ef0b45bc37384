package com.ai.studyengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionWorkflowResponse {

    private String sessionId;
    private String title;
    private int progress;

    /** Every topic of the session, flat, in traversal order. */
    private List<WorkflowNodeResponse> nodes;
}
