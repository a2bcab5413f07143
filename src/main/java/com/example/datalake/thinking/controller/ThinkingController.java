package com.example.datalake.thinking.controller;

import com.example.datalake.thinking.model.ThoughtOutcome;
import com.example.datalake.thinking.model.ThoughtSubmission;
import com.example.datalake.thinking.response.ProcessResponse;
import com.example.datalake.thinking.service.ThoughtService;
import com.example.datalake.thinking.session.SessionHandle;
import com.example.datalake.thinking.session.SessionStore;
import com.example.datalake.thinking.validation.ValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/thinking")
@Tag(name = "Thinking API", description = "Record thoughts without holding a streaming connection")
@RequiredArgsConstructor
public class ThinkingController {

    static final String SESSION_HINT = "sessionHint";

    private final SessionStore sessionStore;
    private final ThoughtService thoughtService;

    @PostMapping("/process")
    @Operation(
            summary = "Record one thought",
            description = "Resolves the session named by sessionHint (or starts a new one) and appends the thought to it."
    )
    public Mono<ResponseEntity<ProcessResponse>> process(@RequestBody Map<String, Object> arguments) {
        return Mono.fromCallable(() -> submit(arguments))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while processing thought", ex);
                    return Mono.just(ResponseEntity.internalServerError().body(toUnexpectedErrorResponse(ex)));
                });
    }

    private ResponseEntity<ProcessResponse> submit(Map<String, Object> arguments) {
        // rejected input must not create, refresh or evict any session
        ValidationResult validation = thoughtService.validate(arguments);
        if (!validation.isValid()) {
            log.debug("Rejected thought: {}", validation.message());
            return ResponseEntity.badRequest().body(ProcessResponse.builder()
                    .notices(validation.notices())
                    .errors(validation.errors())
                    .build());
        }

        Object hint = arguments.get(SESSION_HINT);
        SessionHandle handle = sessionStore.getOrCreate(hint == null ? null : String.valueOf(hint));
        ThoughtSubmission submission = thoughtService.apply(handle.session(), validation);

        ThoughtOutcome outcome = submission.getOutcome();
        return ResponseEntity.ok(ProcessResponse.builder()
                .sessionId(handle.id())
                .sequenceNumber(outcome.getSequenceNumber())
                .totalEstimate(outcome.getTotalEstimate())
                .continuationNeeded(outcome.isContinuationNeeded())
                .branches(outcome.getBranches())
                .logLength(outcome.getLogLength())
                .notices(submission.getNotices())
                .errors(List.of())
                .build());
    }

    private ProcessResponse toUnexpectedErrorResponse(Throwable ex) {
        String detail = ex.getMessage();
        String message = (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
        return ProcessResponse.builder()
                .notices(List.of())
                .errors(List.of(message))
                .build();
    }
}
