package com.gbu.assessment.modules.attempt.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AttemptReviewDto {
    private AttemptSummaryDto attempt;
    private List<ReviewItemDto> questions;
}
