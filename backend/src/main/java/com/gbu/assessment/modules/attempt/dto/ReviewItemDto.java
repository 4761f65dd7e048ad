package com.gbu.assessment.modules.attempt.dto;

import com.gbu.assessment.modules.attempt.PresentedOption;
import com.gbu.assessment.modules.question.AptitudeCategory;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ReviewItemDto {
    private int position;
    private String questionId;
    private String questionText;
    private List<PresentedOption> options;
    private OptionKey selectedOption;
    private OptionKey correctOption;
    private boolean correct;
    private Integer marks;
    private AptitudeCategory category;
    private String explanation;
    private boolean generated;
}
