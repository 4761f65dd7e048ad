package com.gbu.assessment.exception;

public class ResumeQuestionsUnavailableException extends BusinessException {

    public ResumeQuestionsUnavailableException(String message) {
        super("RESUME_QUESTIONS_UNAVAILABLE", message);
    }
}
