package com.gbu.assessment.exception;

public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String resource, String id) {
        super("NOT_FOUND", resource + " not found: " + id);
    }

    public ResourceNotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
