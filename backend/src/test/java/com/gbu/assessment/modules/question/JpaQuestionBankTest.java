package com.gbu.assessment.modules.question;

import com.gbu.assessment.support.TestQuestions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaQuestionBank.class)
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create"
})
class JpaQuestionBankTest {

    @Autowired
    private JpaQuestionBank questionBank;

    @Autowired
    private TestEntityManager entityManager;

    private AptitudeQuestion logicalEasy;
    private AptitudeQuestion logicalHard;
    private AptitudeQuestion verbal;

    private AptitudeQuestion persist(AptitudeCategory category, DifficultyLevel difficulty,
            AptitudeQuestion.QuestionStatus status, AptitudeQuestion.ApprovalStatus approval) {
        AptitudeQuestion question = TestQuestions.bank(category, OptionKey.A, null);
        question.setId(null);
        question.setDifficulty(difficulty);
        question.setStatus(status);
        question.setApprovalStatus(approval);
        return entityManager.persistFlushFind(question);
    }

    @BeforeEach
    void setUp() {
        logicalEasy = persist(AptitudeCategory.LOGICAL, DifficultyLevel.EASY,
                AptitudeQuestion.QuestionStatus.ACTIVE, AptitudeQuestion.ApprovalStatus.APPROVED);
        logicalHard = persist(AptitudeCategory.LOGICAL, DifficultyLevel.HARD,
                AptitudeQuestion.QuestionStatus.ACTIVE, AptitudeQuestion.ApprovalStatus.APPROVED);
        verbal = persist(AptitudeCategory.VERBAL, DifficultyLevel.EASY,
                AptitudeQuestion.QuestionStatus.ACTIVE, AptitudeQuestion.ApprovalStatus.APPROVED);
        persist(AptitudeCategory.LOGICAL, DifficultyLevel.EASY,
                AptitudeQuestion.QuestionStatus.ARCHIVED, AptitudeQuestion.ApprovalStatus.APPROVED);
        persist(AptitudeCategory.LOGICAL, DifficultyLevel.EASY,
                AptitudeQuestion.QuestionStatus.ACTIVE, AptitudeQuestion.ApprovalStatus.PENDING);
    }

    @Test
    @DisplayName("listApproved: only approved active questions are served")
    void listApproved_servableOnly() {
        assertThat(questionBank.listApproved(null, null, Set.of(), 50))
                .extracting(AptitudeQuestion::getId)
                .containsExactlyInAnyOrder(logicalEasy.getId(), logicalHard.getId(), verbal.getId());
    }

    @Test
    @DisplayName("listApproved: filters by category, difficulty and excluded ids")
    void listApproved_filters() {
        assertThat(questionBank.listApproved(AptitudeCategory.LOGICAL, null, Set.of(), 50))
                .extracting(AptitudeQuestion::getId)
                .containsExactlyInAnyOrder(logicalEasy.getId(), logicalHard.getId());
        assertThat(questionBank.listApproved(AptitudeCategory.LOGICAL, DifficultyLevel.HARD, Set.of(), 50))
                .extracting(AptitudeQuestion::getId)
                .containsExactly(logicalHard.getId());
        assertThat(questionBank.listApproved(AptitudeCategory.LOGICAL, null, Set.of(logicalHard.getId()), 50))
                .extracting(AptitudeQuestion::getId)
                .containsExactly(logicalEasy.getId());
    }

    @Test
    @DisplayName("listApproved: limit bounds the result, zero returns nothing")
    void listApproved_limit() {
        assertThat(questionBank.listApproved(null, null, Set.of(), 2)).hasSize(2);
        assertThat(questionBank.listApproved(null, null, Set.of(), 0)).isEmpty();
    }

    @Test
    @DisplayName("getAllById: unknown ids are simply absent")
    void getAllById_partial() {
        UUID unknown = UUID.randomUUID();

        assertThat(questionBank.getAllById(List.of(verbal.getId(), unknown)))
                .containsOnlyKeys(verbal.getId());
        assertThat(questionBank.getAllById(List.of())).isEmpty();
    }

    @Test
    @DisplayName("getById: round-trips the JSON options")
    void getById_options() {
        assertThat(questionBank.getById(verbal.getId()))
                .hasValueSatisfying(q -> assertThat(q.getOptions()).containsEntry(OptionKey.C, "bank c"));
        assertThat(questionBank.getById(UUID.randomUUID())).isEmpty();
    }
}
