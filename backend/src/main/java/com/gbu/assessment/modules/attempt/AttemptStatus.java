package com.gbu.assessment.modules.attempt;

public enum AttemptStatus {
    IN_PROGRESS, COMPLETED
}
