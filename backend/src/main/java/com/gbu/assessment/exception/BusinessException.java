package com.gbu.assessment.exception;

import lombok.Getter;

/**
 * Base of every client-facing domain failure. The {@code errorCode} is stable
 * and lets clients branch without parsing messages.
 */
@Getter
public class BusinessException extends RuntimeException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    private final String errorCode;

    public BusinessException(String message) {
        this(VALIDATION_ERROR, message);
    }

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
