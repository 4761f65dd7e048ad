package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.attempt.AptitudeMode;
import com.gbu.assessment.modules.attempt.AttemptStatus;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class AttemptSummaryDto {
    private UUID id;
    private AptitudeMode mode;
    private AttemptStatus status;
    private AptitudeCategory category;
    private DifficultyLevel difficulty;
    private Integer totalQuestions;
    private Integer correctAnswers;
    private Integer wrongAnswers;
    private Integer skipped;
    private BigDecimal score;
    private Long timeTakenSeconds;
    private Instant startedAt;
    private Instant completedAt;
}
