package com.gbu.assessment.modules.attempt.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Data
@Builder
public class SubmitResultDto {
    private UUID attemptId;
    private BigDecimal score;
    private Integer correct;
    private Integer wrong;
    private Integer skipped;
    private Integer totalQuestions;
    private Long timeTakenSeconds;
    private Instant completedAt;
}
