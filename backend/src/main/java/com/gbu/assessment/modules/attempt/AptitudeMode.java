package com.gbu.assessment.modules.attempt;

public enum AptitudeMode {
    /** Untimed, bank questions only. */
    PRACTICE,
    /** Timed, bank questions plus a small resume-based quota. */
    TEST,
    /** Timed, generated resume questions only. */
    RESUME_ONLY
}
