package com.gbu.assessment.modules.question;

public enum AptitudeCategory {
    QUANTITATIVE,
    LOGICAL,
    VERBAL,
    TECHNICAL,
    DATA_INTERPRETATION,
    // only ever assigned to questions generated from a resume
    RESUME
}
