package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;

/** One option as shown to the student; the key stays canonical. */
public record PresentedOption(OptionKey key, String text) {
}
