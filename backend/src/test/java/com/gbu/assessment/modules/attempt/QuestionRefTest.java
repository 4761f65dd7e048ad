package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.exception.BusinessException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuestionRefTest {

    @Test
    @DisplayName("parse: prefix decides the source")
    void parseUsesPrefix() {
        UUID id = UUID.randomUUID();

        assertThat(QuestionRef.parse("bank:" + id)).isEqualTo(QuestionRef.bank(id));
        assertThat(QuestionRef.parse("gen:" + id)).isEqualTo(QuestionRef.generated(id));
        assertThat(QuestionRef.generated(id).key()).isEqualTo("gen:" + id);
    }

    @Test
    @DisplayName("parse: bare ids and junk are rejected")
    void parseRejectsMalformed() {
        assertThatThrownBy(() -> QuestionRef.parse(UUID.randomUUID().toString()))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> QuestionRef.parse("bank:not-a-uuid"))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> QuestionRef.parse(null))
                .isInstanceOf(BusinessException.class);
    }
}
