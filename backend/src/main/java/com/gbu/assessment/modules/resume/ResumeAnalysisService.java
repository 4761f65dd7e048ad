package com.gbu.assessment.modules.resume;

import com.gbu.assessment.exception.ExternalServiceException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Resume text and skill extraction, owned by the profile side of the platform.
 */
public interface ResumeAnalysisService {

    /**
     * @return extracted resume text, empty when the student has no resume
     * @throws ExternalServiceException when the analysis service is unreachable
     */
    Optional<String> getResumeText(UUID userId);

    /**
     * Skill hints from the latest analysis, running an analysis first when none
     * exists yet.
     *
     * @throws ExternalServiceException when the analysis service is unreachable
     */
    List<String> getSkillHints(UUID userId);
}
