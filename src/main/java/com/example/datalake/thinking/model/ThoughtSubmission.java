package com.example.datalake.thinking.model;

import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** Result of submitting raw arguments to a session: an outcome, or the validation errors. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ThoughtSubmission {
  ThoughtOutcome outcome;
  List<String> errors;
  List<String> notices;

  public static ThoughtSubmission accepted(ThoughtOutcome outcome, List<String> notices) {
    return new ThoughtSubmission(outcome, List.of(), List.copyOf(notices));
  }

  public static ThoughtSubmission rejected(List<String> errors, List<String> notices) {
    return new ThoughtSubmission(null, List.copyOf(errors), List.copyOf(notices));
  }

  public boolean isAccepted() {
    return outcome != null;
  }
}
