package com.ai.studyengine.service.generation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratedFlashcard {

    private String front;
    private String back;
    private String hint;
}
