package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.config.SecurityConfig;
import com.gbu.assessment.exception.AttemptAlreadySubmittedException;
import com.gbu.assessment.exception.NoResumeAvailableException;
import com.gbu.assessment.exception.SessionAlreadyActiveException;
import com.gbu.assessment.exception.SessionExpiredException;
import com.gbu.assessment.modules.attempt.dto.AttemptSessionDto;
import com.gbu.assessment.modules.attempt.dto.DashboardDto;
import com.gbu.assessment.modules.attempt.dto.StartAttemptRequest;
import com.gbu.assessment.modules.attempt.dto.SubmitResultDto;
import com.gbu.assessment.security.AuthenticatedUser;
import com.gbu.assessment.security.JwtTokenProvider;
import com.gbu.assessment.security.SecurityUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.authentication;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AttemptController.class)
@Import({SecurityConfig.class, SecurityUtils.class})
class AttemptControllerTest {

    private static final UUID USER_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID ATTEMPT_ID = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AttemptService attemptService;

    @MockBean
    private AttemptReportService reportService;

    @MockBean
    private JwtTokenProvider jwtTokenProvider;

    private static RequestPostProcessor as(String role) {
        return authentication(new UsernamePasswordAuthenticationToken(
                new AuthenticatedUser(USER_ID, "student@gbu.ac.in", role),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + role))));
    }

    private static AttemptSessionDto session() {
        return AttemptSessionDto.builder()
                .attemptId(ATTEMPT_ID)
                .mode(AptitudeMode.PRACTICE)
                .status(AttemptStatus.IN_PROGRESS)
                .totalQuestions(5)
                .startedAt(Instant.parse("2026-01-01T10:00:00Z"))
                .elapsedSeconds(0L)
                .totalAllowedSeconds(0L)
                .questions(List.of())
                .answers(Map.of())
                .build();
    }

    @Test
    @DisplayName("start: 201 with the new session for the caller")
    void start_created() throws Exception {
        when(attemptService.startAttempt(eq(USER_ID), any(StartAttemptRequest.class))).thenReturn(session());

        mockMvc.perform(post("/api/aptitude/attempts/start")
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":5,\"mode\":\"PRACTICE\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.attemptId").value(ATTEMPT_ID.toString()))
                .andExpect(jsonPath("$.status").value("IN_PROGRESS"));
    }

    @Test
    @DisplayName("start: count below the minimum is a validation error")
    void start_countTooSmall() throws Exception {
        mockMvc.perform(post("/api/aptitude/attempts/start")
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":3,\"mode\":\"PRACTICE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(attemptService);
    }

    @Test
    @DisplayName("start: unknown mode and malformed attempt ids are validation errors")
    void malformedInput() throws Exception {
        mockMvc.perform(post("/api/aptitude/attempts/start")
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":10,\"mode\":\"EXAM\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/aptitude/attempts/{id}", "not-a-uuid").with(as("STUDENT")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(attemptService);
    }

    @Test
    @DisplayName("start: a live attempt already running is a 409")
    void start_conflict() throws Exception {
        when(attemptService.startAttempt(eq(USER_ID), any(StartAttemptRequest.class)))
                .thenThrow(new SessionAlreadyActiveException("An attempt is already in progress"));

        mockMvc.perform(post("/api/aptitude/attempts/start")
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":10,\"mode\":\"TEST\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("start: resume-only without a resume is a 422")
    void start_noResume() throws Exception {
        when(attemptService.startAttempt(eq(USER_ID), any(StartAttemptRequest.class)))
                .thenThrow(new NoResumeAvailableException("Upload a resume first"));

        mockMvc.perform(post("/api/aptitude/attempts/start")
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\":5,\"mode\":\"RESUME_ONLY\",\"resumeQuestionCount\":5}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    @DisplayName("security: requests without a token are rejected before the controller")
    void unauthenticated_forbidden() throws Exception {
        mockMvc.perform(get("/api/aptitude/attempts/active"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(attemptService);
    }

    @Test
    @DisplayName("security: non-student roles cannot take attempts")
    void wrongRole_forbidden() throws Exception {
        mockMvc.perform(get("/api/aptitude/attempts/active").with(as("ADMIN")))
                .andExpect(status().isForbidden());

        verifyNoInteractions(attemptService);
    }

    @Test
    @DisplayName("active: expired attempt maps to 410 SESSION_EXPIRED")
    void active_expired() throws Exception {
        when(attemptService.getActiveAttempt(USER_ID)).thenThrow(new SessionExpiredException(ATTEMPT_ID));

        mockMvc.perform(get("/api/aptitude/attempts/active").with(as("STUDENT")))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));
    }

    @Test
    @DisplayName("autosave: acknowledges with status ok")
    void autosave_ok() throws Exception {
        mockMvc.perform(put("/api/aptitude/attempts/{id}/answers", ATTEMPT_ID)
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{\"bank:33333333-3333-3333-3333-333333333333\":\"B\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        verify(attemptService).autosave(eq(ATTEMPT_ID), eq(USER_ID), anyMap());
    }

    @Test
    @DisplayName("autosave: missing answers map is a validation error")
    void autosave_missingAnswers() throws Exception {
        mockMvc.perform(put("/api/aptitude/attempts/{id}/answers", ATTEMPT_ID)
                        .with(as("STUDENT"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(attemptService, never()).autosave(any(), any(), anyMap());
    }

    @Test
    @DisplayName("submit: body is optional")
    void submit_withoutBody() throws Exception {
        when(attemptService.submit(eq(ATTEMPT_ID), eq(USER_ID), isNull())).thenReturn(SubmitResultDto.builder()
                .attemptId(ATTEMPT_ID)
                .score(new BigDecimal("60.0"))
                .correct(3)
                .wrong(1)
                .skipped(1)
                .totalQuestions(5)
                .build());

        mockMvc.perform(post("/api/aptitude/attempts/{id}/submit", ATTEMPT_ID).with(as("STUDENT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(60.0))
                .andExpect(jsonPath("$.correct").value(3));
    }

    @Test
    @DisplayName("discard: 204 and nothing else")
    void discard_noContent() throws Exception {
        mockMvc.perform(delete("/api/aptitude/attempts/{id}", ATTEMPT_ID).with(as("STUDENT")))
                .andExpect(status().isNoContent());

        verify(attemptService).discard(ATTEMPT_ID, USER_ID);
    }

    @Test
    @DisplayName("discard: already submitted attempt is a 409")
    void discard_completed() throws Exception {
        doThrow(new AttemptAlreadySubmittedException(ATTEMPT_ID))
                .when(attemptService).discard(ATTEMPT_ID, USER_ID);

        mockMvc.perform(delete("/api/aptitude/attempts/{id}", ATTEMPT_ID).with(as("STUDENT")))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("dashboard: literal path is not taken for an attempt id")
    void dashboard_ok() throws Exception {
        when(reportService.getDashboard(USER_ID)).thenReturn(DashboardDto.builder()
                .totalAttempts(2)
                .averageScore(new BigDecimal("75.0"))
                .bestScore(new BigDecimal("90.0"))
                .topicAnalysis(List.of())
                .recentAttempts(List.of())
                .build());

        mockMvc.perform(get("/api/aptitude/attempts/dashboard").with(as("STUDENT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAttempts").value(2));

        verify(attemptService, never()).getAttempt(any(), any());
    }
}
