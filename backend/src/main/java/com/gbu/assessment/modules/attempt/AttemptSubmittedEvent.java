package com.gbu.assessment.modules.attempt;

import java.math.BigDecimal;
import java.util.UUID;

/** Published inside the submitting transaction; listeners act after commit. */
public record AttemptSubmittedEvent(UUID attemptId, UUID userId, BigDecimal score) {
}
