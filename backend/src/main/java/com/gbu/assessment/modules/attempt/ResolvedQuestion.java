package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.AptitudeQuestion;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.OptionKey;

import java.util.Map;

/**
 * Bank or generated question in one shape, as needed for presenting and
 * scoring.
 */
public record ResolvedQuestion(
        QuestionRef ref,
        String questionText,
        Map<OptionKey, String> options,
        OptionKey correctOption,
        String explanation,
        AptitudeCategory category,
        DifficultyLevel difficulty,
        int marks,
        Integer timeLimitSeconds) {

    public static ResolvedQuestion fromBank(AptitudeQuestion question) {
        return new ResolvedQuestion(
                QuestionRef.bank(question.getId()),
                question.getQuestionText(),
                question.getOptions(),
                question.getCorrectOption(),
                question.getExplanation(),
                question.getCategory(),
                question.getDifficulty(),
                question.getMarks() != null ? question.getMarks() : 1,
                question.getTimeLimitSeconds());
    }

    public static ResolvedQuestion fromGenerated(QuestionRef ref, GeneratedQuestion question) {
        return new ResolvedQuestion(
                ref,
                question.questionText(),
                question.options(),
                question.correctOption(),
                question.explanation(),
                question.category(),
                question.difficulty(),
                question.marks(),
                question.timeLimitSeconds());
    }

    public boolean isGenerated() {
        return !ref.isBank();
    }
}
