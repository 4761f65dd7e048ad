package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param score percentage of marks earned, one decimal place
 */
public record ScoreResult(
        int correct,
        int wrong,
        int skipped,
        int earnedMarks,
        int totalMarks,
        BigDecimal score,
        List<ScoredQuestion> questions) {

    /**
     * @param question null when the question could no longer be resolved
     */
    public record ScoredQuestion(int position, QuestionRef ref, ResolvedQuestion question, OptionKey selected,
            boolean correct, int marks) {
    }
}
