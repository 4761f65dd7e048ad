package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.question.AptitudeCategory;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class DashboardDto {
    private long totalAttempts;
    private BigDecimal averageScore;
    private BigDecimal bestScore;
    private List<TopicAnalysisDto> topicAnalysis;
    private List<AttemptSummaryDto> recentAttempts;

    @Data
    @Builder
    public static class TopicAnalysisDto {
        private AptitudeCategory category;
        private long correct;
        private long total;
        /** Percentage, one decimal. */
        private BigDecimal accuracy;
    }
}
