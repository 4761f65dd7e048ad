package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.OptionKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pure scoring over resolved questions. Marks default to 1; the score is
 * earned marks over total marks as a percentage, rounded half-up to one
 * decimal. Correct, wrong and skipped always add up to the question count.
 */
@Slf4j
@Component
public class ScoringEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param order     presentation order of the attempt
     * @param questions resolved questions; refs missing here count as skipped
     *                  and carry no marks
     * @param answers   accepted selections; null or absent means unanswered
     */
    public ScoreResult score(List<QuestionRef> order, Map<QuestionRef, ResolvedQuestion> questions,
            Map<QuestionRef, OptionKey> answers) {
        int correct = 0;
        int wrong = 0;
        int skipped = 0;
        int earned = 0;
        int total = 0;
        List<ScoreResult.ScoredQuestion> scored = new ArrayList<>(order.size());

        for (int position = 0; position < order.size(); position++) {
            QuestionRef ref = order.get(position);
            ResolvedQuestion question = questions.get(ref);
            OptionKey selected = answers.get(ref);
            if (question == null) {
                log.warn("Question {} could not be resolved at scoring; counted as skipped", ref);
                skipped++;
                scored.add(new ScoreResult.ScoredQuestion(position, ref, null, selected, false, 0));
                continue;
            }

            int marks = question.marks() > 0 ? question.marks() : 1;
            total += marks;
            boolean isCorrect = selected != null && selected == question.correctOption();
            if (selected == null) {
                skipped++;
            } else if (isCorrect) {
                correct++;
                earned += marks;
            } else {
                wrong++;
            }
            scored.add(new ScoreResult.ScoredQuestion(position, ref, question, selected, isCorrect, marks));
        }

        BigDecimal score = total > 0
                ? BigDecimal.valueOf(earned).multiply(HUNDRED).divide(BigDecimal.valueOf(total), 1,
                        RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(1);
        return new ScoreResult(correct, wrong, skipped, earned, total, score, scored);
    }
}
