package com.gbu.assessment.modules.resume;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gbu.assessment.exception.ExternalServiceException;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
public class AiResumeAnalysisClient implements ResumeAnalysisService {

    static final int MAX_RESUME_CHARS = 6000;

    private final RestTemplate restTemplate;

    public AiResumeAnalysisClient(@Qualifier("aiRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<String> getResumeText(UUID userId) {
        ResumeTextResponse body;
        try {
            body = restTemplate.getForObject("/ai/resume/{userId}/text", ResumeTextResponse.class, userId);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        } catch (RestClientException e) {
            throw new ExternalServiceException("Resume analysis service unavailable", e);
        }
        if (body == null || body.getText() == null || body.getText().isBlank()) {
            return Optional.empty();
        }
        String text = body.getText();
        return Optional.of(text.length() > MAX_RESUME_CHARS ? text.substring(0, MAX_RESUME_CHARS) : text);
    }

    @Override
    public List<String> getSkillHints(UUID userId) {
        try {
            List<String> hints = fetchSkills(userId);
            if (hints.isEmpty()) {
                log.info("No resume analysis for user {}, requesting one", userId);
                restTemplate.postForLocation("/ai/resume/{userId}/analyze", null, userId);
                hints = fetchSkills(userId);
            }
            return hints;
        } catch (HttpClientErrorException.NotFound e) {
            return List.of();
        } catch (RestClientException e) {
            throw new ExternalServiceException("Resume analysis service unavailable", e);
        }
    }

    private List<String> fetchSkills(UUID userId) {
        SkillsResponse body = restTemplate.getForObject("/ai/resume/{userId}/skills", SkillsResponse.class, userId);
        if (body == null) {
            return List.of();
        }
        List<String> raw = new ArrayList<>();
        if (body.getExtractedSkills() != null) {
            raw.addAll(body.getExtractedSkills());
        }
        if (body.getTechnicalSkills() != null) {
            raw.addAll(body.getTechnicalSkills());
        }
        // Deduplicate case-insensitively, first spelling wins
        Map<String, String> deduped = new LinkedHashMap<>();
        for (String skill : raw) {
            if (skill != null && !skill.isBlank()) {
                deduped.putIfAbsent(skill.trim().toLowerCase(Locale.ROOT), skill.trim());
            }
        }
        return new ArrayList<>(deduped.values());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ResumeTextResponse {
        private String text;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SkillsResponse {
        @JsonProperty("extracted_skills")
        private List<String> extractedSkills;
        @JsonProperty("technical_skills")
        private List<String> technicalSkills;
    }
}
