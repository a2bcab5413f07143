package com.example.datalake.thinking.validation;

import com.example.datalake.thinking.model.ThoughtRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Carries the raw tool arguments through the validators. Validators fill in the record builder
 * and collect rejection reasons and user facing notices.
 */
public class ValidationContext {

  private final Map<String, Object> arguments;
  private final ThoughtRecord.ThoughtRecordBuilder record = ThoughtRecord.builder();
  private final List<String> errors = new ArrayList<>();
  private final List<String> notices = new ArrayList<>();

  public ValidationContext(Map<String, Object> arguments) {
    this.arguments = arguments == null ? Map.of() : arguments;
  }

  public Object argument(String name) {
    return arguments.get(name);
  }

  public ThoughtRecord.ThoughtRecordBuilder record() {
    return record;
  }

  /** Marks the input as invalid for the given reason. */
  public void reject(String reason) {
    errors.add(Objects.requireNonNull(reason, "reason"));
  }

  /** Adds a user visible notice emitted during validation. */
  public void addNotice(String notice) {
    notices.add(Objects.requireNonNull(notice, "notice"));
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public List<String> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  public List<String> getNotices() {
    return Collections.unmodifiableList(notices);
  }
}
