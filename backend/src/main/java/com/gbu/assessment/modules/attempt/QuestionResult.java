package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.OptionKey;

/** Per-question outcome stored on a completed attempt. */
public record QuestionResult(
        OptionKey selected,
        OptionKey correctOption,
        boolean correct,
        int marks,
        AptitudeCategory category) {
}
