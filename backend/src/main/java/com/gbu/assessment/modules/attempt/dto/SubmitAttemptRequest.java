package com.gbu.assessment.modules.attempt.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitAttemptRequest {

    private Map<String, String> answers = new HashMap<>();

    /** Client-side stopwatch; logged only, the server clock decides. */
    @Min(value = 0, message = "Time taken cannot be negative")
    private Long timeTakenSeconds;
}
