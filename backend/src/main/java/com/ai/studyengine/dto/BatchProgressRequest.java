package com.ai.studyengine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchProgressRequest {

    @NotEmpty(message = "updates must not be empty")
    private List<@Valid TopicProgressRequest> updates;
}
