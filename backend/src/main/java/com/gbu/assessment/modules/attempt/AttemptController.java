package com.gbu.assessment.modules.attempt;

import com.gbu.assessment.modules.attempt.dto.AnswersRequest;
import com.gbu.assessment.modules.attempt.dto.AttemptReviewDto;
import com.gbu.assessment.modules.attempt.dto.AttemptSessionDto;
import com.gbu.assessment.modules.attempt.dto.AttemptSummaryDto;
import com.gbu.assessment.modules.attempt.dto.DashboardDto;
import com.gbu.assessment.modules.attempt.dto.StartAttemptRequest;
import com.gbu.assessment.modules.attempt.dto.SubmitAttemptRequest;
import com.gbu.assessment.modules.attempt.dto.SubmitResultDto;
import com.gbu.assessment.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/aptitude/attempts")
@RequiredArgsConstructor
@PreAuthorize("hasRole('STUDENT')")
@Tag(name = "Aptitude Attempts", description = "Timed aptitude attempts: start, resume, autosave, submit, review")
public class AttemptController {

    private final AttemptService attemptService;
    private final AttemptReportService reportService;
    private final SecurityUtils securityUtils;

    @PostMapping("/start")
    @Operation(summary = "Start a new attempt")
    public ResponseEntity<AttemptSessionDto> start(@Valid @RequestBody StartAttemptRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(attemptService.startAttempt(securityUtils.getCurrentUserId(), request));
    }

    @GetMapping("/active")
    @Operation(summary = "Resume the attempt in progress (410 if it expired)")
    public ResponseEntity<AttemptSessionDto> active() {
        return ResponseEntity.ok(attemptService.getActiveAttempt(securityUtils.getCurrentUserId()));
    }

    @GetMapping("/{attemptId}")
    @Operation(summary = "Resume an attempt by id")
    public ResponseEntity<AttemptSessionDto> get(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(attemptService.getAttempt(attemptId, securityUtils.getCurrentUserId()));
    }

    @PutMapping("/{attemptId}/answers")
    @Operation(summary = "Autosave answers")
    public ResponseEntity<Map<String, String>> autosave(@PathVariable UUID attemptId,
            @Valid @RequestBody AnswersRequest request) {
        attemptService.autosave(attemptId, securityUtils.getCurrentUserId(), request.getAnswers());
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @PostMapping("/{attemptId}/submit")
    @Operation(summary = "Submit and score an attempt")
    public ResponseEntity<SubmitResultDto> submit(@PathVariable UUID attemptId,
            @Valid @RequestBody(required = false) SubmitAttemptRequest request) {
        return ResponseEntity.ok(attemptService.submit(attemptId, securityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/{attemptId}")
    @Operation(summary = "Discard an attempt in progress")
    public ResponseEntity<Void> discard(@PathVariable UUID attemptId) {
        attemptService.discard(attemptId, securityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{attemptId}/details")
    @Operation(summary = "Per-question review of a completed attempt")
    public ResponseEntity<AttemptReviewDto> details(@PathVariable UUID attemptId) {
        return ResponseEntity.ok(reportService.getAttemptDetails(attemptId, securityUtils.getCurrentUserId()));
    }

    @GetMapping
    @Operation(summary = "Attempt history, newest first")
    public ResponseEntity<Page<AttemptSummaryDto>> history(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        Pageable pageable = PageRequest.of(page, size, Sort.by("startedAt").descending());
        return ResponseEntity.ok(reportService.getHistory(securityUtils.getCurrentUserId(), pageable));
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Score statistics and per-category accuracy")
    public ResponseEntity<DashboardDto> dashboard() {
        return ResponseEntity.ok(reportService.getDashboard(securityUtils.getCurrentUserId()));
    }
}
