package com.example.datalake.thinking.validation;

import com.example.datalake.thinking.model.ThoughtRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating one submitted thought: either a record ready to be processed or the list
 * of reasons it was refused. Notices are carried in both cases.
 */
public final class ValidationResult {

  private final ThoughtRecord record;
  private final List<String> errors;
  private final List<String> notices;

  private ValidationResult(ThoughtRecord record, List<String> errors, List<String> notices) {
    this.record = record;
    this.errors = List.copyOf(errors);
    this.notices = List.copyOf(notices);
  }

  public static ValidationResult valid(ThoughtRecord record, List<String> notices) {
    return new ValidationResult(Objects.requireNonNull(record, "record"), List.of(), notices);
  }

  public static ValidationResult invalid(List<String> errors, List<String> notices) {
    Objects.requireNonNull(errors, "errors");
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors must not be empty");
    }
    return new ValidationResult(null, errors, notices);
  }

  public boolean isValid() {
    return record != null;
  }

  public Optional<ThoughtRecord> record() {
    return Optional.ofNullable(record);
  }

  public List<String> errors() {
    return errors;
  }

  public List<String> notices() {
    return notices;
  }

  /** All reasons joined into a single line, for logs and plain-text replies. */
  public String message() {
    return String.join("; ", errors);
  }
}
