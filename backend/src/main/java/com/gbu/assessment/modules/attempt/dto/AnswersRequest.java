package com.gbu.assessment.modules.attempt.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Autosave payload: question id to selected option, null or blank to clear. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnswersRequest {

    @NotNull(message = "Answers are required")
    private Map<String, String> answers;
}
