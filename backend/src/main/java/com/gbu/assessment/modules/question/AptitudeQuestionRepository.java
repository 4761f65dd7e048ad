package com.gbu.assessment.modules.question;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface AptitudeQuestionRepository
        extends JpaRepository<AptitudeQuestion, UUID>, JpaSpecificationExecutor<AptitudeQuestion> {
}
