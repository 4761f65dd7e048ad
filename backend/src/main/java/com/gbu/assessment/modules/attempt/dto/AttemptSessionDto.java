package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.attempt.AptitudeMode;
import com.gbu.assessment.modules.attempt.AttemptStatus;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Data
@Builder
public class AttemptSessionDto {
    private UUID attemptId;
    private AptitudeMode mode;
    private AttemptStatus status;
    private AptitudeCategory category;
    private DifficultyLevel difficulty;
    private Integer totalQuestions;
    private Instant startedAt;
    private Long elapsedSeconds;
    /** Zero for untimed attempts. */
    private Long totalAllowedSeconds;
    private List<QuestionBrief> questions;
    /** Saved selections that still count; late ones show as null. */
    private Map<String, OptionKey> answers;
}
