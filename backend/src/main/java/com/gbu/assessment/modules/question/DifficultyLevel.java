package com.gbu.assessment.modules.question;

public enum DifficultyLevel {
    EASY, MEDIUM, HARD
}
