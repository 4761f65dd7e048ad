package com.gbu.assessment.exception;

/**
 * A collaborator (AI question generation, resume analysis) could not be
 * reached or answered garbage. Recovered locally wherever a fallback exists.
 */
public class ExternalServiceException extends BusinessException {

    public ExternalServiceException(String message, Throwable cause) {
        super("EXTERNAL_SERVICE_FAILURE", message);
        initCause(cause);
    }
}
