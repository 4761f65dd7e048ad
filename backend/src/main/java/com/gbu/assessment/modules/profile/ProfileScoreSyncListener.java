package com.gbu.assessment.modules.profile;

import com.gbu.assessment.modules.attempt.AptitudeAttempt;
import com.gbu.assessment.modules.attempt.AptitudeAttemptRepository;
import com.gbu.assessment.modules.attempt.AttemptStatus;
import com.gbu.assessment.modules.attempt.AttemptSubmittedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;

/**
 * After a submit commits, recomputes the profile aptitude score as the
 * average of the student's latest completed attempts and pushes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileScoreSyncListener {

    private final AptitudeAttemptRepository attemptRepository;
    private final ProfileScoreSync profileScoreSync;

    @Value("${assessment.recent-attempt-window:5}")
    private int window;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onAttemptSubmitted(AttemptSubmittedEvent event) {
        try {
            List<BigDecimal> scores = attemptRepository
                    .findByUserIdAndStatusOrderByCompletedAtDesc(event.userId(), AttemptStatus.COMPLETED,
                            PageRequest.of(0, Math.max(1, window)))
                    .stream()
                    .map(AptitudeAttempt::getScore)
                    .filter(Objects::nonNull)
                    .toList();
            if (scores.isEmpty()) {
                return;
            }
            BigDecimal average = scores.stream()
                    .reduce(BigDecimal.ZERO, BigDecimal::add)
                    .divide(BigDecimal.valueOf(scores.size()), 1, RoundingMode.HALF_UP);
            profileScoreSync.updateAptitudeScore(event.userId(), average);
        } catch (RuntimeException e) {
            log.warn("Profile score sync failed for attempt {}: {}", event.attemptId(), e.getMessage());
        }
    }
}
