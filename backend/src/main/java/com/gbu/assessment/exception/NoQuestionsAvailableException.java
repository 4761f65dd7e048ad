package com.gbu.assessment.exception;

public class NoQuestionsAvailableException extends BusinessException {

    public NoQuestionsAvailableException(String message) {
        super("NO_QUESTIONS_AVAILABLE", message);
    }
}
