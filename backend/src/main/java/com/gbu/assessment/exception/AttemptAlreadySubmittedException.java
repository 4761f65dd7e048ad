package com.gbu.assessment.exception;

import java.util.UUID;

public class AttemptAlreadySubmittedException extends BusinessException {

    public AttemptAlreadySubmittedException(UUID attemptId) {
        super("ALREADY_SUBMITTED", "Assessment already submitted: " + attemptId);
    }
}
