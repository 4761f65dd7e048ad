package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.Builder;

import java.util.Map;

/**
 * Resume-based question frozen into the attempt at start. It exists nowhere
 * else, so it carries everything scoring and review need.
 *
 * @param timeLimitSeconds already the effective limit for the attempt's mode
 */
@Builder
public record GeneratedQuestion(
        String questionText,
        Map<OptionKey, String> options,
        OptionKey correctOption,
        String explanation,
        AptitudeCategory category,
        DifficultyLevel difficulty,
        int marks,
        Integer timeLimitSeconds,
        String skill) {
}
