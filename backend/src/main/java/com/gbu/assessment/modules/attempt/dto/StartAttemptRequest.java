package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.attempt.AptitudeMode;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartAttemptRequest {

    private AptitudeCategory category;

    private DifficultyLevel difficulty;

    @NotNull(message = "Question count is required")
    @Min(value = 5, message = "At least 5 questions are required")
    @Max(value = 50, message = "At most 50 questions are allowed")
    @Builder.Default
    private Integer count = 10;

    @NotNull(message = "Mode is required")
    @Builder.Default
    private AptitudeMode mode = AptitudeMode.PRACTICE;

    /** Requested resume questions; clamped to [0, count]. */
    @Min(value = 0, message = "Resume question count cannot be negative")
    private Integer resumeQuestionCount;

    @Builder.Default
    private List<AptitudeCategory> excludeCategories = new ArrayList<>();
}
