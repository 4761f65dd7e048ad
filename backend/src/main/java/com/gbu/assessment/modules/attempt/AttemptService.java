package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.exception.AttemptAlreadySubmittedException;
import com.gbu.assessment.exception.BusinessException;
import com.gbu.assessment.exception.ResourceNotFoundException;
import com.gbu.assessment.exception.SessionAlreadyActiveException;
import com.gbu.assessment.exception.SessionExpiredException;
import com.gbu.assessment.modules.attempt.dto.AttemptSessionDto;
import com.gbu.assessment.modules.attempt.dto.QuestionBrief;
import com.gbu.assessment.modules.attempt.dto.StartAttemptRequest;
import com.gbu.assessment.modules.attempt.dto.SubmitAttemptRequest;
import com.gbu.assessment.modules.attempt.dto.SubmitResultDto;
import com.gbu.assessment.modules.question.AptitudeQuestion;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Attempt lifecycle: start, resume, autosave, submit and discard.
 * <p>
 * Every state change loads the attempt under a row lock, so autosave, submit
 * and expiry of one attempt never interleave. Expiry is detected lazily on
 * the next call touching the attempt; there is no background timer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptService {

    // Client stopwatch drift worth a log line
    private static final long CLIENT_TIME_DRIFT_SECONDS = 30;

    private final AptitudeAttemptRepository attemptRepository;
    private final QuestionSourceAdapter sourceAdapter;
    private final QuestionResolver questionResolver;
    private final OptionShuffler optionShuffler;
    private final DeadlineCalculator deadlineCalculator;
    private final ScoringEngine scoringEngine;
    private final AttemptDetailWriter detailWriter;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Random random;

    @Value("${assessment.min-question-count:5}")
    private int minQuestionCount;

    @Value("${assessment.max-question-count:50}")
    private int maxQuestionCount;

    /**
     * Composes and persists a new attempt. An attempt still in progress blocks
     * the start unless it has already expired, in which case it is submitted
     * first.
     */
    @Transactional
    public AttemptSessionDto startAttempt(UUID userId, StartAttemptRequest request) {
        validateStartRequest(request);
        Instant now = clock.instant();

        AptitudeAttempt existing = attemptRepository.findActiveForUpdate(userId).orElse(null);
        if (existing != null) {
            if (!deadlineCalculator.isExpired(existing, now)) {
                throw new SessionAlreadyActiveException(
                        "You already have an attempt in progress. Resume or submit it first.");
            }
            log.info("Attempt {} expired before user {} started a new one, submitting it", existing.getId(), userId);
            autoSubmit(existing, now);
            // Release the active slot before the new row claims it
            attemptRepository.flush();
        }

        ComposedQuestionSet composed = sourceAdapter.compose(userId, request);
        boolean timed = deadlineCalculator.isTimed(request.getMode());

        Map<QuestionRef, ResolvedQuestion> questions = new LinkedHashMap<>();
        for (AptitudeQuestion question : composed.bankQuestions()) {
            ResolvedQuestion resolved = ResolvedQuestion.fromBank(question);
            questions.put(resolved.ref(), resolved);
        }
        composed.generated().forEach((ref, question) ->
                questions.put(ref, ResolvedQuestion.fromGenerated(ref, question)));

        // Interleave bank and generated questions
        List<QuestionRef> order = new ArrayList<>(questions.keySet());
        Collections.shuffle(order, random);

        List<String> refKeys = new ArrayList<>(order.size());
        Map<String, List<OptionKey>> optionOrders = new LinkedHashMap<>();
        Map<String, Integer> timeLimits = new LinkedHashMap<>();
        for (QuestionRef ref : order) {
            ResolvedQuestion question = questions.get(ref);
            String key = ref.key();
            refKeys.add(key);
            optionOrders.put(key, optionShuffler.shuffledOrder(question.options()));
            Integer limit = ref.isBank()
                    ? deadlineCalculator.effectiveLimit(question.timeLimitSeconds(), timed)
                    : question.timeLimitSeconds();
            if (limit != null) {
                timeLimits.put(key, limit);
            }
        }
        Map<String, GeneratedQuestion> generated = new LinkedHashMap<>();
        composed.generated().forEach((ref, question) -> generated.put(ref.key(), question));

        AptitudeAttempt attempt = AptitudeAttempt.builder()
                .userId(userId)
                .activeOwnerId(userId)
                .category(request.getCategory())
                .difficulty(request.getDifficulty())
                .mode(request.getMode())
                .status(AttemptStatus.IN_PROGRESS)
                .totalQuestions(refKeys.size())
                .questionRefs(refKeys)
                .optionOrders(optionOrders)
                .questionTimeLimits(timeLimits)
                .generatedQuestions(generated)
                .answers(new LinkedHashMap<>())
                .startedAt(now)
                .build();
        try {
            attempt = attemptRepository.saveAndFlush(attempt);
        } catch (DataIntegrityViolationException e) {
            // Lost the race against a concurrent start for the same user
            throw new SessionAlreadyActiveException(
                    "You already have an attempt in progress. Resume or submit it first.");
        }

        log.info("Attempt {} started: user={} mode={} questions={}", attempt.getId(), userId,
                attempt.getMode(), attempt.getTotalQuestions());
        return toSessionDto(attempt, questions, now);
    }

    /**
     * The user's attempt in progress, submitted on the spot if it has expired.
     *
     * @throws SessionExpiredException after auto-submitting an expired attempt
     */
    @Transactional(noRollbackFor = SessionExpiredException.class)
    public AttemptSessionDto getActiveAttempt(UUID userId) {
        AptitudeAttempt attempt = attemptRepository.findActiveForUpdate(userId)
                .orElseThrow(() -> new ResourceNotFoundException("No attempt in progress"));
        return resume(attempt);
    }

    @Transactional(noRollbackFor = SessionExpiredException.class)
    public AttemptSessionDto getAttempt(UUID attemptId, UUID userId) {
        AptitudeAttempt attempt = loadOwnedForUpdate(attemptId, userId);
        requireInProgress(attempt);
        return resume(attempt);
    }

    /**
     * Stores answers with the server's elapsed time. Answers to questions
     * whose deadline has passed are dropped without error.
     */
    @Transactional(noRollbackFor = SessionExpiredException.class)
    public void autosave(UUID attemptId, UUID userId, Map<String, String> answers) {
        AptitudeAttempt attempt = loadOwnedForUpdate(attemptId, userId);
        requireInProgress(attempt);

        Instant now = clock.instant();
        if (deadlineCalculator.isExpired(attempt, now)) {
            autoSubmit(attempt, now);
            throw new SessionExpiredException(attemptId);
        }

        Map<QuestionRef, OptionKey> incoming = parseAnswers(attempt, answers);
        long elapsed = deadlineCalculator.elapsedSeconds(attempt, now);
        Map<String, Long> schedule = deadlineCalculator.schedule(attempt);
        Map<String, AnswerRecord> merged = new LinkedHashMap<>(attempt.getAnswers());
        int dropped = merge(merged, incoming, schedule, elapsed);

        attempt.setAnswers(merged);
        attemptRepository.save(attempt);
        log.debug("Autosave attempt={} received={} dropped={} elapsed={}s", attemptId, incoming.size(), dropped,
                elapsed);
    }

    /**
     * Scores and completes the attempt. Accepted after expiry as well; late
     * answers simply do not count.
     */
    @Transactional
    public SubmitResultDto submit(UUID attemptId, UUID userId, SubmitAttemptRequest request) {
        AptitudeAttempt attempt = loadOwnedForUpdate(attemptId, userId);
        requireInProgress(attempt);

        Instant now = clock.instant();
        long elapsed = deadlineCalculator.elapsedSeconds(attempt, now);
        Long reported = request != null ? request.getTimeTakenSeconds() : null;
        if (reported != null && Math.abs(reported - elapsed) > CLIENT_TIME_DRIFT_SECONDS) {
            log.debug("Attempt {} client reported {}s, server measured {}s", attemptId, reported, elapsed);
        }

        Map<QuestionRef, OptionKey> incoming = parseAnswers(attempt, request != null ? request.getAnswers() : null);
        Map<String, AnswerRecord> merged = new LinkedHashMap<>(attempt.getAnswers());
        merge(merged, incoming, deadlineCalculator.schedule(attempt), elapsed);

        return complete(attempt, merged, elapsed, now);
    }

    @Transactional
    public void discard(UUID attemptId, UUID userId) {
        AptitudeAttempt attempt = loadOwnedForUpdate(attemptId, userId);
        requireInProgress(attempt);
        attemptRepository.delete(attempt);
        log.info("Attempt {} discarded by user {}", attemptId, userId);
    }

    private AttemptSessionDto resume(AptitudeAttempt attempt) {
        Instant now = clock.instant();
        if (deadlineCalculator.isExpired(attempt, now)) {
            autoSubmit(attempt, now);
            throw new SessionExpiredException(attempt.getId());
        }
        return toSessionDto(attempt, questionResolver.resolve(attempt), now);
    }

    private SubmitResultDto autoSubmit(AptitudeAttempt attempt, Instant now) {
        log.info("Auto-submitting expired attempt {}", attempt.getId());
        return complete(attempt, attempt.getAnswers(), deadlineCalculator.elapsedSeconds(attempt, now), now);
    }

    private SubmitResultDto complete(AptitudeAttempt attempt, Map<String, AnswerRecord> answers, long elapsed,
            Instant now) {
        Map<String, Long> schedule = deadlineCalculator.schedule(attempt);
        Map<QuestionRef, OptionKey> accepted = new LinkedHashMap<>();
        deadlineCalculator.validAnswers(attempt, answers, schedule)
                .forEach((key, selected) -> accepted.put(QuestionRef.parse(key), selected));

        Map<QuestionRef, ResolvedQuestion> questions = questionResolver.resolve(attempt);
        ScoreResult result = scoringEngine.score(attempt.orderedRefs(), questions, accepted);

        Map<String, QuestionResult> results = new LinkedHashMap<>();
        for (ScoreResult.ScoredQuestion scored : result.questions()) {
            if (scored.question() != null) {
                results.put(scored.ref().key(), new QuestionResult(scored.selected(),
                        scored.question().correctOption(), scored.correct(), scored.marks(),
                        scored.question().category()));
            }
        }

        attempt.setAnswers(new LinkedHashMap<>(answers));
        attempt.setResults(results);
        attempt.setCorrectAnswers(result.correct());
        attempt.setWrongAnswers(result.wrong());
        attempt.setSkipped(result.skipped());
        attempt.setScore(result.score());
        attempt.setTimeTakenSeconds(elapsed);
        attempt.setStatus(AttemptStatus.COMPLETED);
        attempt.setCompletedAt(now);
        attempt.setActiveOwnerId(null);
        attempt = attemptRepository.save(attempt);

        detailWriter.replace(attempt, result);
        eventPublisher.publishEvent(new AttemptSubmittedEvent(attempt.getId(), attempt.getUserId(),
                attempt.getScore()));

        log.info("Attempt {} completed: score={} correct={} wrong={} skipped={} elapsed={}s", attempt.getId(),
                result.score(), result.correct(), result.wrong(), result.skipped(), elapsed);
        return SubmitResultDto.builder()
                .attemptId(attempt.getId())
                .score(attempt.getScore())
                .correct(result.correct())
                .wrong(result.wrong())
                .skipped(result.skipped())
                .totalQuestions(attempt.getTotalQuestions())
                .timeTakenSeconds(elapsed)
                .completedAt(now)
                .build();
    }

    /**
     * Stamps incoming answers with {@code elapsed}. An answer past its deadline
     * is not stored, so an earlier accepted answer for that question survives.
     *
     * @return number of dropped answers
     */
    private int merge(Map<String, AnswerRecord> stored, Map<QuestionRef, OptionKey> incoming,
            Map<String, Long> schedule, long elapsed) {
        int dropped = 0;
        for (Map.Entry<QuestionRef, OptionKey> entry : incoming.entrySet()) {
            String key = entry.getKey().key();
            if (!deadlineCalculator.accepts(schedule, key, elapsed)) {
                dropped++;
                continue;
            }
            if (entry.getValue() == null) {
                stored.remove(key);
            } else {
                stored.put(key, new AnswerRecord(entry.getValue(), elapsed));
            }
        }
        return dropped;
    }

    private Map<QuestionRef, OptionKey> parseAnswers(AptitudeAttempt attempt, Map<String, String> answers) {
        Map<QuestionRef, OptionKey> parsed = new LinkedHashMap<>();
        if (answers == null) {
            return parsed;
        }
        for (Map.Entry<String, String> entry : answers.entrySet()) {
            QuestionRef ref = QuestionRef.parse(entry.getKey());
            if (!attempt.contains(ref)) {
                throw new BusinessException("Question " + entry.getKey() + " is not part of this attempt");
            }
            OptionKey selected = OptionKey.parse(entry.getValue());
            List<OptionKey> available = attempt.getOptionOrders().get(ref.key());
            if (selected != null && available != null && !available.contains(selected)) {
                throw new BusinessException("Option " + selected + " does not exist for question " + ref);
            }
            parsed.put(ref, selected);
        }
        return parsed;
    }

    private void validateStartRequest(StartAttemptRequest request) {
        if (request.getMode() == null) {
            throw new BusinessException("Mode is required");
        }
        Integer count = request.getCount();
        if (count == null || count < minQuestionCount || count > maxQuestionCount) {
            throw new BusinessException(
                    "Question count must be between " + minQuestionCount + " and " + maxQuestionCount);
        }
    }

    private AptitudeAttempt loadOwnedForUpdate(UUID attemptId, UUID userId) {
        return attemptRepository.findByIdForUpdate(attemptId)
                .filter(attempt -> attempt.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Attempt", attemptId.toString()));
    }

    private static void requireInProgress(AptitudeAttempt attempt) {
        if (!attempt.isInProgress()) {
            throw new AttemptAlreadySubmittedException(attempt.getId());
        }
    }

    private AttemptSessionDto toSessionDto(AptitudeAttempt attempt, Map<QuestionRef, ResolvedQuestion> questions,
            Instant now) {
        Map<String, Long> schedule = deadlineCalculator.schedule(attempt);
        List<QuestionBrief> briefs = new ArrayList<>();
        for (QuestionRef ref : attempt.orderedRefs()) {
            ResolvedQuestion question = questions.get(ref);
            if (question == null) {
                continue;
            }
            String key = ref.key();
            briefs.add(QuestionBrief.builder()
                    .id(key)
                    .questionText(question.questionText())
                    .options(optionShuffler.present(question.options(), attempt.getOptionOrders().get(key)))
                    .category(question.category())
                    .difficulty(question.difficulty())
                    .marks(question.marks())
                    .timeLimitSeconds(attempt.getQuestionTimeLimits().get(key))
                    .deadlineSeconds(schedule.get(key))
                    .generated(question.isGenerated())
                    .build());
        }
        return AttemptSessionDto.builder()
                .attemptId(attempt.getId())
                .mode(attempt.getMode())
                .status(attempt.getStatus())
                .category(attempt.getCategory())
                .difficulty(attempt.getDifficulty())
                .totalQuestions(attempt.getTotalQuestions())
                .startedAt(attempt.getStartedAt())
                .elapsedSeconds(deadlineCalculator.elapsedSeconds(attempt, now))
                .totalAllowedSeconds(deadlineCalculator.totalAllowedSeconds(schedule))
                .questions(briefs)
                .answers(deadlineCalculator.validAnswers(attempt, attempt.getAnswers(), schedule))
                .build();
    }
}
