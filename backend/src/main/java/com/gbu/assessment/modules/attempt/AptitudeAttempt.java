package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.OptionKey;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One student's attempt. The question set, option orders and per-question
 * limits are frozen at start; only {@code answers} changes until submit.
 */
@Entity
@Table(name = "aptitude_attempts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AptitudeAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /**
     * Equals {@code userId} while the attempt is in progress and null after.
     * The unique index on this column allows one active attempt per user.
     */
    @Column(name = "active_owner_id", unique = true)
    private UUID activeOwnerId;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private AptitudeCategory category;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private DifficultyLevel difficulty;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AptitudeMode mode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AttemptStatus status = AttemptStatus.IN_PROGRESS;

    @Column(name = "total_questions", nullable = false)
    private Integer totalQuestions;

    /** Presentation order; this is what the student sees, in this order. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "question_refs", nullable = false)
    @Builder.Default
    private List<String> questionRefs = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "option_orders", nullable = false)
    @Builder.Default
    private Map<String, List<OptionKey>> optionOrders = new LinkedHashMap<>();

    /** Effective limits for timed modes; absent means no limit. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "question_time_limits", nullable = false)
    @Builder.Default
    private Map<String, Integer> questionTimeLimits = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "generated_questions", nullable = false)
    @Builder.Default
    private Map<String, GeneratedQuestion> generatedQuestions = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(nullable = false)
    @Builder.Default
    private Map<String, AnswerRecord> answers = new LinkedHashMap<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "results")
    private Map<String, QuestionResult> results;

    @Column(name = "correct_answers")
    private Integer correctAnswers;

    @Column(name = "wrong_answers")
    private Integer wrongAnswers;

    @Column(name = "skipped")
    private Integer skipped;

    @Column(precision = 4, scale = 1)
    private BigDecimal score;

    @Column(name = "time_taken_seconds")
    private Long timeTakenSeconds;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public boolean isInProgress() {
        return status == AttemptStatus.IN_PROGRESS;
    }

    public List<QuestionRef> orderedRefs() {
        List<QuestionRef> refs = new ArrayList<>(questionRefs.size());
        for (String key : questionRefs) {
            refs.add(QuestionRef.parse(key));
        }
        return refs;
    }

    public boolean contains(QuestionRef ref) {
        return questionRefs.contains(ref.key());
    }
}
