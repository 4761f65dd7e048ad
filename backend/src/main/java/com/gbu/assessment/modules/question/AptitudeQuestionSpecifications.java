package com.gbu.assessment.modules.question;

import org.springframework.data.jpa.domain.Specification;

import java.util.Collection;
import java.util.UUID;

final class AptitudeQuestionSpecifications {

    private AptitudeQuestionSpecifications() {
    }

    static Specification<AptitudeQuestion> servable() {
        return (root, query, cb) -> cb.and(
                cb.equal(root.get("approvalStatus"), AptitudeQuestion.ApprovalStatus.APPROVED),
                cb.equal(root.get("status"), AptitudeQuestion.QuestionStatus.ACTIVE));
    }

    static Specification<AptitudeQuestion> inCategory(AptitudeCategory category) {
        return (root, query, cb) -> category == null ? null : cb.equal(root.get("category"), category);
    }

    static Specification<AptitudeQuestion> withDifficulty(DifficultyLevel difficulty) {
        return (root, query, cb) -> difficulty == null ? null : cb.equal(root.get("difficulty"), difficulty);
    }

    static Specification<AptitudeQuestion> excludingIds(Collection<UUID> ids) {
        return (root, query, cb) -> ids == null || ids.isEmpty() ? null : cb.not(root.get("id").in(ids));
    }
}
