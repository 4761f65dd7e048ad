package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;

/**
 * Last saved selection for a question.
 *
 * @param selected       null when the student cleared the answer
 * @param savedAtSeconds server-measured seconds since the attempt started
 */
public record AnswerRecord(OptionKey selected, long savedAtSeconds) {
}
