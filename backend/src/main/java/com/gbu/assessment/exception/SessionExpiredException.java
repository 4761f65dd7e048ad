package com.gbu.assessment.exception;

import java.util.UUID;

/**
 * Raised after an attempt ran past its last deadline and was submitted by the
 * server. Callers must not roll back on it: the auto-submission has to stick.
 */
public class SessionExpiredException extends BusinessException {

    public SessionExpiredException(UUID attemptId) {
        super("SESSION_EXPIRED", "Session expired: attempt " + attemptId + " was submitted automatically");
    }
}
