package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeQuestion;

import java.util.List;
import java.util.Map;

/**
 * Questions picked for a new attempt, before interleaving.
 *
 * @param generated generated questions keyed by their freshly minted refs
 */
public record ComposedQuestionSet(List<AptitudeQuestion> bankQuestions, Map<QuestionRef, GeneratedQuestion> generated) {

    public int size() {
        return bankQuestions.size() + generated.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
