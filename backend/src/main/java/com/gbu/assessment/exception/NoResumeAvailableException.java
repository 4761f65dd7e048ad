package com.gbu.assessment.exception;

public class NoResumeAvailableException extends BusinessException {

    public NoResumeAvailableException(String message) {
        super("NO_RESUME_AVAILABLE", message);
    }
}
