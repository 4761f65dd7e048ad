package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeQuestion;
import com.gbu.assessment.modules.question.QuestionBank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns an attempt's refs back into questions: bank refs through one batch
 * lookup, generated refs from the payload frozen in the attempt.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionResolver {

    private final QuestionBank questionBank;

    /** Resolved questions in presentation order; unresolvable refs are left out. */
    public Map<QuestionRef, ResolvedQuestion> resolve(AptitudeAttempt attempt) {
        List<QuestionRef> refs = attempt.orderedRefs();

        // Batch-load bank questions in one query
        List<UUID> bankIds = new ArrayList<>();
        for (QuestionRef ref : refs) {
            if (ref.isBank()) {
                bankIds.add(ref.id());
            }
        }
        Map<UUID, AptitudeQuestion> bank = bankIds.isEmpty() ? Map.of() : questionBank.getAllById(bankIds);

        Map<QuestionRef, ResolvedQuestion> resolved = new LinkedHashMap<>();
        for (QuestionRef ref : refs) {
            if (ref.isBank()) {
                AptitudeQuestion question = bank.get(ref.id());
                if (question == null) {
                    log.warn("Bank question {} of attempt {} no longer exists", ref.id(), attempt.getId());
                    continue;
                }
                resolved.put(ref, ResolvedQuestion.fromBank(question));
            } else {
                GeneratedQuestion question = attempt.getGeneratedQuestions().get(ref.key());
                if (question == null) {
                    log.warn("Generated question {} missing from attempt {}", ref, attempt.getId());
                    continue;
                }
                resolved.put(ref, ResolvedQuestion.fromGenerated(ref, question));
            }
        }
        return resolved;
    }
}
