package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cumulative per-question deadlines, measured in seconds from attempt start.
 * Question i must be answered by the sum of the limits of questions 0..i;
 * a question without a positive limit has no deadline and adds nothing.
 * All timing uses the server clock, never client-reported durations.
 */
@Component
public class DeadlineCalculator {

    @Value("${assessment.default-question-time-limit-seconds:60}")
    private int defaultTimeLimitSeconds;

    public boolean isTimed(AptitudeMode mode) {
        return mode == AptitudeMode.TEST || mode == AptitudeMode.RESUME_ONLY;
    }

    /** Limit to freeze into a new attempt; null when the mode is untimed. */
    public Integer effectiveLimit(Integer rawLimitSeconds, boolean timed) {
        if (!timed) {
            return null;
        }
        return rawLimitSeconds != null ? rawLimitSeconds : defaultTimeLimitSeconds;
    }

    /**
     * Deadline per question key, in presentation order. Values are null for
     * questions that are not enforced.
     */
    public Map<String, Long> schedule(AptitudeAttempt attempt) {
        Map<String, Long> deadlines = new LinkedHashMap<>();
        boolean timed = isTimed(attempt.getMode());
        long cumulative = 0;
        for (String key : attempt.getQuestionRefs()) {
            Integer limit = timed ? attempt.getQuestionTimeLimits().get(key) : null;
            if (limit == null || limit <= 0) {
                deadlines.put(key, null);
                continue;
            }
            cumulative += limit;
            deadlines.put(key, cumulative);
        }
        return deadlines;
    }

    /** Largest deadline, or 0 when nothing is enforced. */
    public long totalAllowedSeconds(Map<String, Long> schedule) {
        long max = 0;
        for (Long deadline : schedule.values()) {
            if (deadline != null && deadline > max) {
                max = deadline;
            }
        }
        return max;
    }

    public long elapsedSeconds(AptitudeAttempt attempt, Instant now) {
        long elapsed = Duration.between(attempt.getStartedAt(), now).getSeconds();
        return Math.max(0, elapsed);
    }

    public boolean isExpired(AptitudeAttempt attempt, Instant now) {
        if (!attempt.isInProgress() || !isTimed(attempt.getMode())) {
            return false;
        }
        long totalAllowed = totalAllowedSeconds(schedule(attempt));
        return totalAllowed > 0 && elapsedSeconds(attempt, now) > totalAllowed;
    }

    /** An answer counts only if it was saved at or before its question's deadline. */
    public boolean accepts(Map<String, Long> schedule, String refKey, long savedAtSeconds) {
        Long deadline = schedule.get(refKey);
        return deadline == null || savedAtSeconds <= deadline;
    }

    /**
     * Stored selections with late ones replaced by null. Keys follow
     * presentation order; unanswered questions are absent.
     */
    public Map<String, OptionKey> validAnswers(AptitudeAttempt attempt, Map<String, AnswerRecord> answers,
            Map<String, Long> schedule) {
        Map<String, OptionKey> valid = new LinkedHashMap<>();
        for (String key : attempt.getQuestionRefs()) {
            AnswerRecord answer = answers.get(key);
            if (answer == null) {
                continue;
            }
            valid.put(key, accepts(schedule, key, answer.savedAtSeconds()) ? answer.selected() : null);
        }
        return valid;
    }
}
