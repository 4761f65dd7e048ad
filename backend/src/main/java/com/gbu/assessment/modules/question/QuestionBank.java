package com.gbu.assessment.modules.question;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to approved bank questions.
 */
public interface QuestionBank {

    /**
     * Approved, active questions matching the optional filters.
     *
     * @param category   null for any category
     * @param difficulty null for any difficulty
     * @param excludeIds ids to leave out, may be empty
     * @param limit      upper bound on the result size
     */
    List<AptitudeQuestion> listApproved(AptitudeCategory category, DifficultyLevel difficulty,
            Collection<UUID> excludeIds, int limit);

    Optional<AptitudeQuestion> getById(UUID id);

    /** Batch lookup; ids without a row are simply absent from the map. */
    Map<UUID, AptitudeQuestion> getAllById(Collection<UUID> ids);
}
