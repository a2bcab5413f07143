package com.example.datalake.thinking.validation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Validates that the caller said whether more thoughts follow. */
@Component
@Order(3)
public class ContinuationFlagValidator implements Validator {

  static final String FIELD = "continuationNeeded";

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUIRED_FIELDS;
  }

  @Override
  public void validate(ValidationContext context) {
    if (context.argument(FIELD) instanceof Boolean flag) {
      context.record().continuationNeeded(flag);
      return;
    }
    context.reject("Invalid continuationNeeded: must be a boolean");
  }
}
