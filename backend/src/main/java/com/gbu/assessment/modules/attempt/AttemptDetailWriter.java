package com.gbu.assessment.modules.attempt;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces an attempt's review rows with rows built from a score result.
 */
@Component
@RequiredArgsConstructor
public class AttemptDetailWriter {

    private final AttemptDetailRepository detailRepository;
    private final OptionShuffler optionShuffler;

    public List<AttemptDetail> replace(AptitudeAttempt attempt, ScoreResult result) {
        detailRepository.deleteByAttemptId(attempt.getId());

        List<AttemptDetail> rows = new ArrayList<>();
        for (ScoreResult.ScoredQuestion scored : result.questions()) {
            ResolvedQuestion question = scored.question();
            if (question == null) {
                continue;
            }
            String key = scored.ref().key();
            rows.add(AttemptDetail.builder()
                    .attemptId(attempt.getId())
                    .position(scored.position())
                    .questionRef(key)
                    .questionText(question.questionText())
                    .presentedOptions(optionShuffler.present(question.options(),
                            attempt.getOptionOrders().get(key)))
                    .selectedOption(scored.selected())
                    .correctOption(question.correctOption())
                    .isCorrect(scored.correct())
                    .marks(scored.marks())
                    .category(question.category())
                    .explanation(question.explanation())
                    .isGenerated(question.isGenerated())
                    .build());
        }
        return detailRepository.saveAll(rows);
    }
}
