package com.gbu.assessment.modules.generation;

import com.gbu.assessment.modules.question.OptionKey;
import lombok.Builder;

import java.util.Map;

/**
 * One MCQ proposed by the generation service or the fallback catalog.
 *
 * @param skill the resume skill this question was written for, if known
 */
@Builder
public record GeneratedQuestionCandidate(
        String questionText,
        Map<OptionKey, String> options,
        OptionKey correctOption,
        String explanation,
        Integer marks,
        Integer timeLimitSeconds,
        String skill) {

    public boolean isUsable() {
        return questionText != null && !questionText.isBlank()
                && options != null && options.size() == OptionKey.values().length
                && options.values().stream().allMatch(text -> text != null && !text.isBlank())
                && correctOption != null && options.containsKey(correctOption);
    }
}
