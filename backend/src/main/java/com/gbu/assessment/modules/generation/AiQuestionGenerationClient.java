package com.gbu.assessment.modules.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gbu.assessment.exception.ExternalServiceException;
import com.gbu.assessment.modules.question.DifficultyLevel;
import com.gbu.assessment.modules.question.OptionKey;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the AI service's resume question endpoint. Timeouts come from the
 * {@code aiRestTemplate} bean.
 */
@Slf4j
@Component
public class AiQuestionGenerationClient implements QuestionGenerationService {

    static final String GENERATE_PATH = "/ai/aptitude/resume-questions";

    private final RestTemplate restTemplate;

    public AiQuestionGenerationClient(@Qualifier("aiRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<GeneratedQuestionCandidate> generate(String resumeText, List<String> skillHints,
            DifficultyLevel difficulty, int count, List<String> avoidTexts) {
        if (count <= 0) {
            return List.of();
        }
        GenerateRequest request = new GenerateRequest();
        request.setResumeText(resumeText);
        request.setSkillHints(skillHints);
        request.setDifficulty(difficulty.name());
        request.setCount(count);
        request.setAvoidQuestions(avoidTexts);

        GenerateResponse body;
        try {
            body = restTemplate.postForObject(GENERATE_PATH, request, GenerateResponse.class);
        } catch (RestClientException e) {
            throw new ExternalServiceException("Question generation service unavailable", e);
        }
        if (body == null || body.getQuestions() == null) {
            return List.of();
        }

        List<GeneratedQuestionCandidate> candidates = new ArrayList<>();
        for (GeneratedItem item : body.getQuestions()) {
            GeneratedQuestionCandidate candidate = toCandidate(item);
            if (candidate != null && candidate.isUsable()) {
                candidates.add(candidate);
            } else {
                log.warn("Discarding malformed generated question: {}", item.getQuestionText());
            }
            if (candidates.size() == count) {
                break;
            }
        }
        log.info("AI service returned {} usable question(s) of {} requested", candidates.size(), count);
        return candidates;
    }

    private GeneratedQuestionCandidate toCandidate(GeneratedItem item) {
        if (item.getOptions() == null) {
            return null;
        }
        Map<OptionKey, String> options = new EnumMap<>(OptionKey.class);
        try {
            item.getOptions().forEach((key, text) -> options.put(OptionKey.parse(key), text));
            return GeneratedQuestionCandidate.builder()
                    .questionText(item.getQuestionText())
                    .options(options)
                    .correctOption(OptionKey.parse(item.getCorrectOption()))
                    .explanation(item.getExplanation())
                    .marks(item.getMarks())
                    .timeLimitSeconds(item.getTimeLimitSeconds())
                    .skill(item.getSkill())
                    .build();
        } catch (RuntimeException e) {
            // option keys outside A-D or a null key
            return null;
        }
    }

    @Data
    static class GenerateRequest {
        @JsonProperty("resume_text")
        private String resumeText;
        @JsonProperty("skill_hints")
        private List<String> skillHints;
        private String difficulty;
        private int count;
        @JsonProperty("avoid_questions")
        private List<String> avoidQuestions;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GenerateResponse {
        private List<GeneratedItem> questions;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GeneratedItem {
        @JsonProperty("question_text")
        private String questionText;
        private Map<String, String> options;
        @JsonProperty("correct_option")
        private String correctOption;
        private String explanation;
        private Integer marks;
        @JsonProperty("time_limit_seconds")
        private Integer timeLimitSeconds;
        private String skill;
    }
}
