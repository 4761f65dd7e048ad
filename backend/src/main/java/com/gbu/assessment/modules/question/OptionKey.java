package com.gbu.assessment.modules.question;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gbu.assessment.exception.BusinessException;

import java.util.Locale;

/** Canonical MCQ option keys. Display order never changes a key. */
public enum OptionKey {
    A, B, C, D;

    /**
     * Case-insensitive parse; blank means "no answer".
     *
     * @throws BusinessException for anything other than A-D
     */
    @JsonCreator
    public static OptionKey parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OptionKey.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException("Invalid option '" + value + "', expected one of A, B, C, D");
        }
    }
}
