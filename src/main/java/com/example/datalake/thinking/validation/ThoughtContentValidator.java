package com.example.datalake.thinking.validation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Validates that the thought text is present and non-empty. */
@Component
@Order(1)
public class ThoughtContentValidator implements Validator {

  static final String FIELD = "thought";

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUIRED_FIELDS;
  }

  @Override
  public void validate(ValidationContext context) {
    if (context.argument(FIELD) instanceof String text && !text.isEmpty()) {
      context.record().content(text);
      return;
    }
    context.reject("Invalid thought: must be a non-empty string");
  }
}
