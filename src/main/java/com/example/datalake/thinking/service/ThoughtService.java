package com.example.datalake.thinking.service;

import com.example.datalake.thinking.model.ThoughtOutcome;
import com.example.datalake.thinking.model.ThoughtSubmission;
import com.example.datalake.thinking.session.ThinkingSession;
import com.example.datalake.thinking.validation.ValidationResult;
import com.example.datalake.thinking.validation.ValidationService;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Validates submitted arguments and applies the resulting thought to a session. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThoughtService {

  private final ValidationService validationService;

  public ThoughtSubmission submit(ThinkingSession session, Map<String, Object> arguments) {
    return apply(session, validate(arguments));
  }

  /** Validates without touching any session, so callers can refuse input before resolving one. */
  public ValidationResult validate(Map<String, Object> arguments) {
    return validationService.validate(arguments);
  }

  public ThoughtSubmission apply(ThinkingSession session, ValidationResult validation) {
    if (!validation.isValid()) {
      log.debug("Rejected thought for session {}: {}", session.getId(), validation.message());
      return ThoughtSubmission.rejected(validation.errors(), validation.notices());
    }

    ThoughtOutcome outcome = session.process(validation.record().orElseThrow());
    return ThoughtSubmission.accepted(outcome, validation.notices());
  }
}
