package com.gbu.assessment.exception;

public class SessionAlreadyActiveException extends BusinessException {

    public SessionAlreadyActiveException(String message) {
        super("ATTEMPT_ALREADY_ACTIVE", message);
    }
}
