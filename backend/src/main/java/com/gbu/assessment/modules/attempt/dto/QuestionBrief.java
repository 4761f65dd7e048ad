package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.attempt.PresentedOption;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.DifficultyLevel;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/** A question as sent to the student. Never carries the correct option. */
@Data
@Builder
public class QuestionBrief {
    private String id;
    private String questionText;
    private List<PresentedOption> options;
    private AptitudeCategory category;
    private DifficultyLevel difficulty;
    private Integer marks;
    private Integer timeLimitSeconds;
    /** Seconds from attempt start; null when not enforced. */
    private Long deadlineSeconds;
    private boolean generated;
}
