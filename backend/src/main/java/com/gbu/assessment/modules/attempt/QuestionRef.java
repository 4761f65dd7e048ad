package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.exception.BusinessException;

import java.util.Objects;
import java.util.UUID;

/**
 * Stable identifier of one question inside an attempt. Bank questions keep
 * their bank id; generated questions get an id minted at start. The string
 * form ({@code bank:<uuid>} / {@code gen:<uuid>}) is what clients and the
 * stored attempt JSON use.
 */
public record QuestionRef(Source source, UUID id) {

    private static final String BANK_PREFIX = "bank:";
    private static final String GENERATED_PREFIX = "gen:";

    public enum Source {
        BANK, GENERATED
    }

    public QuestionRef {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(id, "id");
    }

    public static QuestionRef bank(UUID id) {
        return new QuestionRef(Source.BANK, id);
    }

    public static QuestionRef generated(UUID id) {
        return new QuestionRef(Source.GENERATED, id);
    }

    public static QuestionRef newGenerated() {
        return generated(UUID.randomUUID());
    }

    /**
     * @throws BusinessException when the key has no known prefix or a malformed id
     */
    public static QuestionRef parse(String key) {
        if (key == null) {
            throw new BusinessException("Question id is required");
        }
        try {
            if (key.startsWith(BANK_PREFIX)) {
                return bank(UUID.fromString(key.substring(BANK_PREFIX.length())));
            }
            if (key.startsWith(GENERATED_PREFIX)) {
                return generated(UUID.fromString(key.substring(GENERATED_PREFIX.length())));
            }
        } catch (IllegalArgumentException e) {
            throw new BusinessException("Malformed question id: " + key);
        }
        throw new BusinessException("Malformed question id: " + key);
    }

    public boolean isBank() {
        return source == Source.BANK;
    }

    public String key() {
        return (isBank() ? BANK_PREFIX : GENERATED_PREFIX) + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
