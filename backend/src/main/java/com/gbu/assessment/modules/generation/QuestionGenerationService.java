package com.gbu.assessment.modules.generation;

import com.gbu.assessment.exception.ExternalServiceException;
import com.gbu.assessment.modules.question.DifficultyLevel;

import java.util.List;

/**
 * Generative question authoring. May return fewer questions than asked for.
 */
public interface QuestionGenerationService {

    /**
     * @param avoidTexts question texts the student saw recently; the generator
     *                   should not repeat them
     * @throws ExternalServiceException when the service is unreachable or times out
     */
    List<GeneratedQuestionCandidate> generate(String resumeText, List<String> skillHints,
            DifficultyLevel difficulty, int count, List<String> avoidTexts);
}
