package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.OptionKey;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Review row written at submit: the question exactly as the student saw it
 * plus the outcome. Rows are replaced as a whole on every re-score.
 */
@Entity
@Table(name = "aptitude_attempt_details")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AttemptDetail {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "attempt_id", nullable = false)
    private UUID attemptId;

    @Column(nullable = false)
    private Integer position;

    @Column(name = "question_ref", nullable = false, length = 64)
    private String questionRef;

    @Column(name = "question_text", nullable = false, columnDefinition = "TEXT")
    private String questionText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "presented_options", nullable = false)
    private List<PresentedOption> presentedOptions;

    @Enumerated(EnumType.STRING)
    @Column(name = "selected_option", length = 1)
    private OptionKey selectedOption;

    @Enumerated(EnumType.STRING)
    @Column(name = "correct_option", nullable = false, length = 1)
    private OptionKey correctOption;

    @Column(name = "is_correct", nullable = false)
    private Boolean isCorrect;

    @Column(nullable = false)
    private Integer marks;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private AptitudeCategory category;

    @Column(columnDefinition = "TEXT")
    private String explanation;

    @Column(name = "is_generated", nullable = false)
    private Boolean isGenerated;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
