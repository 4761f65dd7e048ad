package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.exception.BusinessException;
import com.gbu.assessment.exception.ExternalServiceException;
import com.gbu.assessment.exception.NoQuestionsAvailableException;
import com.gbu.assessment.exception.NoResumeAvailableException;
import com.gbu.assessment.exception.ResumeQuestionsUnavailableException;
import com.gbu.assessment.modules.attempt.dto.StartAttemptRequest;
import com.gbu.assessment.modules.generation.FallbackSkillQuestions;
import com.gbu.assessment.modules.generation.GeneratedQuestionCandidate;
import com.gbu.assessment.modules.generation.QuestionGenerationService;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.AptitudeQuestion;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.QuestionBank;
import com.gbu.assessment.modules.resume.ResumeAnalysisService;
import com.gbu.assessment.modules.resume.ResumeSkillScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Picks the questions for a new attempt: approved bank questions, resume
 * questions from the generation service, and the fallback catalog when the
 * service comes up short. Questions from the student's recent attempts are
 * avoided where the bank is deep enough.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionSourceAdapter {

    private static final int DEFAULT_TEST_RESUME_QUOTA = 3;

    private final QuestionBank questionBank;
    private final QuestionGenerationService generationService;
    private final ResumeAnalysisService resumeAnalysisService;
    private final ResumeSkillScanner skillScanner;
    private final FallbackSkillQuestions fallbackQuestions;
    private final AptitudeAttemptRepository attemptRepository;
    private final DeadlineCalculator deadlineCalculator;
    private final Random random;

    @Value("${assessment.recent-attempt-window:5}")
    private int recentAttemptWindow;

    /**
     * @throws NoResumeAvailableException          RESUME_ONLY and the student has no resume
     * @throws ResumeQuestionsUnavailableException RESUME_ONLY and nothing could be generated
     * @throws NoQuestionsAvailableException       nothing to ask at all
     */
    public ComposedQuestionSet compose(UUID userId, StartAttemptRequest request) {
        int count = request.getCount();
        AptitudeMode mode = request.getMode();
        boolean timed = deadlineCalculator.isTimed(mode);
        Integer resumeRequest = request.getResumeQuestionCount() != null
                ? Math.max(0, Math.min(request.getResumeQuestionCount(), count))
                : null;
        RecentContext recent = recentContext(userId);

        Map<QuestionRef, GeneratedQuestion> generated = new LinkedHashMap<>();
        List<AptitudeQuestion> bank = List.of();

        if (mode == AptitudeMode.RESUME_ONLY) {
            int desired = resumeRequest != null ? resumeRequest : count;
            if (desired <= 0) {
                throw new BusinessException("Resume question count must be greater than 0 for RESUME_ONLY");
            }
            String resumeText = requireResumeText(userId);
            generated = generate(userId, resumeText, desired, request.getDifficulty(), recent.generatedTexts(), timed);
            if (generated.isEmpty()) {
                throw new ResumeQuestionsUnavailableException(
                        "Could not generate questions from your resume. Try again later or pick another mode.");
            }
        } else {
            if (mode == AptitudeMode.TEST) {
                int quota = resumeRequest != null
                        ? resumeRequest
                        : Math.min(DEFAULT_TEST_RESUME_QUOTA, Math.max(1, count / 4));
                if (quota > 0) {
                    Optional<String> resumeText = optionalResumeText(userId);
                    if (resumeText.isPresent()) {
                        generated = generate(userId, resumeText.get(), quota, request.getDifficulty(),
                                recent.generatedTexts(), timed);
                    }
                }
            }
            int bankCount = Math.max(0, count - generated.size());
            bank = selectBankQuestions(request, bankCount, recent.bankIds());
        }

        ComposedQuestionSet composed = new ComposedQuestionSet(bank, generated);
        if (composed.isEmpty()) {
            throw new NoQuestionsAvailableException("No approved aptitude questions are available for this selection");
        }
        log.info("Composed attempt for user {}: mode={} bank={} generated={}", userId, mode,
                bank.size(), generated.size());
        return composed;
    }

    private List<AptitudeQuestion> selectBankQuestions(StartAttemptRequest request, int bankCount,
            Set<UUID> recentIds) {
        if (bankCount <= 0) {
            return List.of();
        }
        AptitudeCategory category = request.getCategory();
        DifficultyLevel difficulty = request.getDifficulty();
        // Fetch a superset so filtering and shuffling still leave enough
        int limit = category != null ? bankCount * 2 : bankCount * 3;
        List<AptitudeCategory> excluded = request.getExcludeCategories() != null
                ? request.getExcludeCategories()
                : List.of();

        List<AptitudeQuestion> fresh = withoutCategories(
                questionBank.listApproved(category, difficulty, recentIds, limit), excluded);
        List<AptitudeQuestion> pool = fresh;
        if (fresh.size() < bankCount && !recentIds.isEmpty()) {
            // Bank too shallow to avoid repeats; allow recently seen questions
            log.debug("Only {} unseen bank questions for {} requested, allowing repeats", fresh.size(), bankCount);
            pool = withoutCategories(questionBank.listApproved(category, difficulty, Set.of(), limit), excluded);
        }

        List<AptitudeQuestion> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return shuffled.size() > bankCount ? new ArrayList<>(shuffled.subList(0, bankCount)) : shuffled;
    }

    private static List<AptitudeQuestion> withoutCategories(List<AptitudeQuestion> questions,
            List<AptitudeCategory> excluded) {
        if (excluded.isEmpty()) {
            return questions;
        }
        List<AptitudeQuestion> kept = new ArrayList<>();
        for (AptitudeQuestion question : questions) {
            if (!excluded.contains(question.getCategory())) {
                kept.add(question);
            }
        }
        return kept;
    }

    private Map<QuestionRef, GeneratedQuestion> generate(UUID userId, String resumeText, int desired,
            DifficultyLevel requestedDifficulty, List<String> avoidTexts, boolean timed) {
        DifficultyLevel difficulty = requestedDifficulty != null ? requestedDifficulty : DifficultyLevel.MEDIUM;
        List<String> skillHints = skillHints(userId, resumeText);

        List<GeneratedQuestionCandidate> candidates = new ArrayList<>();
        try {
            candidates.addAll(generationService.generate(resumeText, skillHints, difficulty, desired, avoidTexts));
        } catch (ExternalServiceException e) {
            log.warn("Question generation failed for user {}: {}", userId, e.getMessage());
        }
        if (candidates.size() < desired && !skillHints.isEmpty()) {
            List<GeneratedQuestionCandidate> fallback = fallbackQuestions.build(skillHints,
                    desired - candidates.size());
            if (!fallback.isEmpty()) {
                log.info("Topping up {} resume questions from the fallback catalog for user {}",
                        fallback.size(), userId);
                candidates.addAll(fallback);
            }
        }

        Map<QuestionRef, GeneratedQuestion> generated = new LinkedHashMap<>();
        for (GeneratedQuestionCandidate candidate : candidates) {
            if (generated.size() >= desired) {
                break;
            }
            if (!candidate.isUsable()) {
                continue;
            }
            generated.put(QuestionRef.newGenerated(), GeneratedQuestion.builder()
                    .questionText(candidate.questionText())
                    .options(candidate.options())
                    .correctOption(candidate.correctOption())
                    .explanation(candidate.explanation())
                    .category(AptitudeCategory.RESUME)
                    .difficulty(difficulty)
                    .marks(candidate.marks() != null && candidate.marks() > 0 ? candidate.marks() : 1)
                    .timeLimitSeconds(deadlineCalculator.effectiveLimit(candidate.timeLimitSeconds(), timed))
                    .skill(candidate.skill())
                    .build());
        }
        return generated;
    }

    private List<String> skillHints(UUID userId, String resumeText) {
        List<String> hints = List.of();
        try {
            hints = resumeAnalysisService.getSkillHints(userId);
        } catch (ExternalServiceException e) {
            log.warn("Skill lookup failed for user {}: {}", userId, e.getMessage());
        }
        if (hints.isEmpty()) {
            hints = skillScanner.scan(resumeText);
        }
        return hints;
    }

    private String requireResumeText(UUID userId) {
        Optional<String> resumeText;
        try {
            resumeText = resumeAnalysisService.getResumeText(userId);
        } catch (ExternalServiceException e) {
            log.warn("Resume lookup failed for user {}: {}", userId, e.getMessage());
            throw new NoQuestionsAvailableException("Resume questions are unavailable right now. Try again later.");
        }
        return resumeText.filter(text -> !text.isBlank())
                .orElseThrow(() -> new NoResumeAvailableException(
                        "Upload a resume before starting a resume-only attempt"));
    }

    private Optional<String> optionalResumeText(UUID userId) {
        try {
            return resumeAnalysisService.getResumeText(userId).filter(text -> !text.isBlank());
        } catch (ExternalServiceException e) {
            log.warn("Resume lookup failed for user {}, continuing with bank questions: {}", userId,
                    e.getMessage());
            return Optional.empty();
        }
    }

    private RecentContext recentContext(UUID userId) {
        Set<UUID> bankIds = new LinkedHashSet<>();
        List<String> generatedTexts = new ArrayList<>();
        if (recentAttemptWindow <= 0) {
            return new RecentContext(bankIds, generatedTexts);
        }
        List<AptitudeAttempt> recent = attemptRepository.findByUserIdOrderByStartedAtDesc(userId,
                PageRequest.of(0, recentAttemptWindow));
        for (AptitudeAttempt attempt : recent) {
            for (QuestionRef ref : attempt.orderedRefs()) {
                if (ref.isBank()) {
                    bankIds.add(ref.id());
                }
            }
            for (GeneratedQuestion question : attempt.getGeneratedQuestions().values()) {
                if (question.questionText() != null) {
                    generatedTexts.add(question.questionText());
                }
            }
        }
        return new RecentContext(bankIds, generatedTexts);
    }

    private record RecentContext(Set<UUID> bankIds, List<String> generatedTexts) {
    }
}
