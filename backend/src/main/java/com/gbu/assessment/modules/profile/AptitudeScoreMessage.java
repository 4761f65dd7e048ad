package com.gbu.assessment.modules.profile;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record AptitudeScoreMessage(UUID userId, BigDecimal aptitudeScore, Instant updatedAt) {
}
