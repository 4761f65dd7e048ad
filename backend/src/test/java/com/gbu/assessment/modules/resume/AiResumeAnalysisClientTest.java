package com.gbu.assessment.modules.resume;

import com.gbu.assessment.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class AiResumeAnalysisClientTest {

    private static final String BASE = "http://ai.test";
    private static final UUID USER_ID = UUID.fromString("44444444-4444-4444-4444-444444444444");

    private MockRestServiceServer server;
    private AiResumeAnalysisClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new AiResumeAnalysisClient(restTemplate);
    }

    @Test
    @DisplayName("getResumeText: long text is cut to the prompt limit")
    void resumeText_truncated() {
        String longText = "a".repeat(AiResumeAnalysisClient.MAX_RESUME_CHARS + 500);
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/text"))
                .andRespond(withSuccess("{\"text\":\"" + longText + "\"}", MediaType.APPLICATION_JSON));

        assertThat(client.getResumeText(USER_ID))
                .hasValueSatisfying(text -> assertThat(text).hasSize(AiResumeAnalysisClient.MAX_RESUME_CHARS));
    }

    @Test
    @DisplayName("getResumeText: 404 and blank text mean no resume")
    void resumeText_missing() {
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/text"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        assertThat(client.getResumeText(USER_ID)).isEmpty();

        server.reset();
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/text"))
                .andRespond(withSuccess("{\"text\":\"   \"}", MediaType.APPLICATION_JSON));
        assertThat(client.getResumeText(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("getResumeText: outage is an ExternalServiceException")
    void resumeText_outage() {
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/text")).andRespond(withServerError());

        assertThatThrownBy(() -> client.getResumeText(USER_ID)).isInstanceOf(ExternalServiceException.class);
    }

    @Test
    @DisplayName("getSkillHints: merges both lists without case-insensitive duplicates")
    void skillHints_deduplicated() {
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/skills"))
                .andRespond(withSuccess("""
                        {"extracted_skills": ["Java", "Docker", " "],
                         "technical_skills": ["docker", "PostgreSQL", null]}
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.getSkillHints(USER_ID)).containsExactly("Java", "Docker", "PostgreSQL");
    }

    @Test
    @DisplayName("getSkillHints: triggers analysis once when nothing is known yet")
    void skillHints_analyzesOnDemand() {
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/skills"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/analyze"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/skills"))
                .andRespond(withSuccess("{\"technical_skills\": [\"React\"]}", MediaType.APPLICATION_JSON));

        assertThat(client.getSkillHints(USER_ID)).containsExactly("React");
        server.verify();
    }

    @Test
    @DisplayName("getSkillHints: unknown student has no hints")
    void skillHints_notFound() {
        server.expect(requestTo(BASE + "/ai/resume/" + USER_ID + "/skills"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.getSkillHints(USER_ID)).isEmpty();
    }
}
