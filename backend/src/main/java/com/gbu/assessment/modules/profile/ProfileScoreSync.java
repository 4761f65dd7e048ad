package com.gbu.assessment.modules.profile;

import java.math.BigDecimal;
import java.util.UUID;

/** Pushes a student's aptitude score to the profile owner. Best effort. */
public interface ProfileScoreSync {

    void updateAptitudeScore(UUID userId, BigDecimal score);
}
