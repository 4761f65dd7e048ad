package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.exception.BusinessException;
import com.gbu.assessment.exception.ResourceNotFoundException;
import com.gbu.assessment.modules.attempt.dto.AttemptReviewDto;
import com.gbu.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.gbu.assessment.modules.attempt.dto.DashboardDto;
import com.gbu.assessment.modules.attempt.dto.ReviewItemDto;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side for a student's own attempts: history, per-question review and
 * the dashboard.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptReportService {

    private static final int DASHBOARD_RECENT_ATTEMPTS = 5;

    private final AptitudeAttemptRepository attemptRepository;
    private final AttemptDetailRepository detailRepository;
    private final AttemptDetailWriter detailWriter;
    private final QuestionResolver questionResolver;
    private final ScoringEngine scoringEngine;
    private final DeadlineCalculator deadlineCalculator;

    @Transactional(readOnly = true)
    public Page<AttemptSummaryDto> getHistory(UUID userId, Pageable pageable) {
        return attemptRepository.findByUserId(userId, pageable).map(this::toSummary);
    }

    /**
     * Review of a completed attempt. Rows lost since submit are rebuilt from
     * the stored results.
     */
    @Transactional
    public AttemptReviewDto getAttemptDetails(UUID attemptId, UUID userId) {
        AptitudeAttempt attempt = attemptRepository.findById(attemptId)
                .filter(a -> a.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
        if (attempt.isInProgress()) {
            throw new BusinessException("Attempt has not been submitted yet");
        }

        List<AttemptDetail> rows = detailRepository.findByAttemptIdOrderByPositionAsc(attemptId);
        if (rows.isEmpty() && attempt.getTotalQuestions() != null && attempt.getTotalQuestions() > 0) {
            rows = rebuildDetails(attempt);
        }

        List<ReviewItemDto> items = rows.stream().map(this::toReviewItem).toList();
        return AttemptReviewDto.builder()
                .attempt(toSummary(attempt))
                .questions(items)
                .build();
    }

    @Transactional(readOnly = true)
    public DashboardDto getDashboard(UUID userId) {
        AptitudeAttemptRepository.AttemptStats stats = attemptRepository.findCompletedStats(userId);
        long total = stats != null ? stats.getTotalAttempts() : 0;
        BigDecimal average = stats != null && stats.getAverageScore() != null
                ? BigDecimal.valueOf(stats.getAverageScore()).setScale(1, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(1);
        BigDecimal best = stats != null && stats.getBestScore() != null
                ? stats.getBestScore()
                : BigDecimal.ZERO.setScale(1);

        List<DashboardDto.TopicAnalysisDto> topics = detailRepository.findTopicStats(userId).stream()
                .map(t -> DashboardDto.TopicAnalysisDto.builder()
                        .category(t.getCategory())
                        .correct(t.getCorrect() != null ? t.getCorrect() : 0)
                        .total(t.getTotal() != null ? t.getTotal() : 0)
                        .accuracy(percentage(t.getCorrect(), t.getTotal()))
                        .build())
                .toList();

        List<AttemptSummaryDto> recent = attemptRepository
                .findByUserIdAndStatusOrderByCompletedAtDesc(userId, AttemptStatus.COMPLETED,
                        PageRequest.of(0, DASHBOARD_RECENT_ATTEMPTS))
                .stream().map(this::toSummary).toList();

        return DashboardDto.builder()
                .totalAttempts(total)
                .averageScore(average)
                .bestScore(best)
                .topicAnalysis(topics)
                .recentAttempts(recent)
                .build();
    }

    private List<AttemptDetail> rebuildDetails(AptitudeAttempt attempt) {
        Map<QuestionRef, OptionKey> selections = new LinkedHashMap<>();
        if (attempt.getResults() != null && !attempt.getResults().isEmpty()) {
            attempt.getResults().forEach((key, result) -> selections.put(QuestionRef.parse(key), result.selected()));
        } else {
            deadlineCalculator.validAnswers(attempt, attempt.getAnswers(), deadlineCalculator.schedule(attempt))
                    .forEach((key, selected) -> selections.put(QuestionRef.parse(key), selected));
        }
        ScoreResult result = scoringEngine.score(attempt.orderedRefs(), questionResolver.resolve(attempt),
                selections);
        List<AttemptDetail> rows = detailWriter.replace(attempt, result);
        log.info("Rebuilt {} review row(s) for attempt {}", rows.size(), attempt.getId());
        return rows;
    }

    private static BigDecimal percentage(Long part, Long whole) {
        if (part == null || whole == null || whole == 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return BigDecimal.valueOf(part).multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(whole), 1, RoundingMode.HALF_UP);
    }

    private ReviewItemDto toReviewItem(AttemptDetail d) {
        return ReviewItemDto.builder()
                .position(d.getPosition())
                .questionId(d.getQuestionRef())
                .questionText(d.getQuestionText())
                .options(d.getPresentedOptions())
                .selectedOption(d.getSelectedOption())
                .correctOption(d.getCorrectOption())
                .correct(Boolean.TRUE.equals(d.getIsCorrect()))
                .marks(d.getMarks())
                .category(d.getCategory())
                .explanation(d.getExplanation())
                .generated(Boolean.TRUE.equals(d.getIsGenerated()))
                .build();
    }

    public AttemptSummaryDto toSummary(AptitudeAttempt a) {
        return AttemptSummaryDto.builder()
                .id(a.getId())
                .mode(a.getMode())
                .status(a.getStatus())
                .category(a.getCategory())
                .difficulty(a.getDifficulty())
                .totalQuestions(a.getTotalQuestions())
                .correctAnswers(a.getCorrectAnswers())
                .wrongAnswers(a.getWrongAnswers())
                .skipped(a.getSkipped())
                .score(a.getScore())
                .timeTakenSeconds(a.getTimeTakenSeconds())
                .startedAt(a.getStartedAt())
                .completedAt(a.getCompletedAt())
                .build();
    }
}
