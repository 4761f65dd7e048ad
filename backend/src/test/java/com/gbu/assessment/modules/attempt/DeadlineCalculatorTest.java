package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineCalculatorTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private DeadlineCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new DeadlineCalculator();
        ReflectionTestUtils.setField(calculator, "defaultTimeLimitSeconds", 60);
    }

    private AptitudeAttempt attempt(AptitudeMode mode, Integer... limits) {
        List<String> refs = new ArrayList<>();
        Map<String, Integer> timeLimits = new LinkedHashMap<>();
        for (Integer limit : limits) {
            String key = QuestionRef.bank(UUID.randomUUID()).key();
            refs.add(key);
            if (limit != null) {
                timeLimits.put(key, limit);
            }
        }
        return AptitudeAttempt.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .mode(mode)
                .totalQuestions(refs.size())
                .questionRefs(refs)
                .questionTimeLimits(timeLimits)
                .startedAt(START)
                .build();
    }

    @Test
    @DisplayName("effectiveLimit: untimed modes get no limit, timed modes default missing limits")
    void effectiveLimit() {
        assertThat(calculator.effectiveLimit(30, false)).isNull();
        assertThat(calculator.effectiveLimit(null, false)).isNull();
        assertThat(calculator.effectiveLimit(30, true)).isEqualTo(30);
        assertThat(calculator.effectiveLimit(null, true)).isEqualTo(60);
    }

    @Test
    @DisplayName("isTimed: only TEST and RESUME_ONLY are timed")
    void isTimed() {
        assertThat(calculator.isTimed(AptitudeMode.PRACTICE)).isFalse();
        assertThat(calculator.isTimed(AptitudeMode.TEST)).isTrue();
        assertThat(calculator.isTimed(AptitudeMode.RESUME_ONLY)).isTrue();
    }

    @Test
    @DisplayName("schedule: deadlines are cumulative and skip non-positive limits")
    void scheduleIsCumulative() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 30, 0, 45, null, 15);
        List<String> refs = attempt.getQuestionRefs();

        Map<String, Long> schedule = calculator.schedule(attempt);

        assertThat(schedule.get(refs.get(0))).isEqualTo(30L);
        assertThat(schedule.get(refs.get(1))).isNull();
        assertThat(schedule.get(refs.get(2))).isEqualTo(75L);
        assertThat(schedule.get(refs.get(3))).isNull();
        assertThat(schedule.get(refs.get(4))).isEqualTo(90L);
        assertThat(calculator.totalAllowedSeconds(schedule)).isEqualTo(90L);
    }

    @Test
    @DisplayName("schedule: practice attempts enforce nothing")
    void practiceHasNoDeadlines() {
        AptitudeAttempt attempt = attempt(AptitudeMode.PRACTICE, 30, 30);

        Map<String, Long> schedule = calculator.schedule(attempt);

        assertThat(schedule.values()).containsOnlyNulls();
        assertThat(calculator.totalAllowedSeconds(schedule)).isZero();
        assertThat(calculator.isExpired(attempt, START.plusSeconds(100_000))).isFalse();
    }

    @Test
    @DisplayName("isExpired: strictly after the last deadline")
    void expiryBoundary() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 10, 10, 10);

        assertThat(calculator.isExpired(attempt, START.plusSeconds(30))).isFalse();
        assertThat(calculator.isExpired(attempt, START.plusSeconds(31))).isTrue();
    }

    @Test
    @DisplayName("isExpired: completed attempts never expire")
    void completedNeverExpires() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 10);
        attempt.setStatus(AttemptStatus.COMPLETED);

        assertThat(calculator.isExpired(attempt, START.plusSeconds(500))).isFalse();
    }

    @Test
    @DisplayName("accepts: an answer saved exactly at the deadline still counts")
    void acceptsAtDeadline() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 10, 10);
        String first = attempt.getQuestionRefs().get(0);
        Map<String, Long> schedule = calculator.schedule(attempt);

        assertThat(calculator.accepts(schedule, first, 10)).isTrue();
        assertThat(calculator.accepts(schedule, first, 11)).isFalse();
    }

    @Test
    @DisplayName("validAnswers: late selections become null, unanswered stay absent")
    void validAnswersNullsLateSelections() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 3, 60, 60);
        List<String> refs = attempt.getQuestionRefs();
        Map<String, AnswerRecord> answers = new LinkedHashMap<>();
        answers.put(refs.get(0), new AnswerRecord(OptionKey.A, 5));
        answers.put(refs.get(1), new AnswerRecord(OptionKey.B, 5));

        Map<String, OptionKey> valid = calculator.validAnswers(attempt, answers, calculator.schedule(attempt));

        assertThat(valid).containsEntry(refs.get(0), null);
        assertThat(valid).containsEntry(refs.get(1), OptionKey.B);
        assertThat(valid).doesNotContainKey(refs.get(2));
    }

    @Test
    @DisplayName("elapsedSeconds: never negative")
    void elapsedNeverNegative() {
        AptitudeAttempt attempt = attempt(AptitudeMode.TEST, 10);

        assertThat(calculator.elapsedSeconds(attempt, START.minusSeconds(5))).isZero();
        assertThat(calculator.elapsedSeconds(attempt, START.plusMillis(12_900))).isEqualTo(12);
    }
}
