package com.example.datalake.thinking.validation;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Validates the claimed position and the estimated total, both positive integers. */
@Component
@Order(2)
public class SequenceFieldsValidator implements Validator {

  static final String SEQUENCE_NUMBER = "sequenceNumber";
  static final String TOTAL_ESTIMATE = "totalEstimate";

  @Override
  public ValidationStage stage() {
    return ValidationStage.REQUIRED_FIELDS;
  }

  @Override
  public void validate(ValidationContext context) {
    Integer sequenceNumber = positiveInt(context.argument(SEQUENCE_NUMBER));
    if (sequenceNumber == null) {
      context.reject("Invalid sequenceNumber: must be a positive integer");
    } else {
      context.record().sequenceNumber(sequenceNumber);
    }

    Integer totalEstimate = positiveInt(context.argument(TOTAL_ESTIMATE));
    if (totalEstimate == null) {
      context.reject("Invalid totalEstimate: must be a positive integer");
    } else {
      context.record().totalEstimate(totalEstimate);
    }
  }

  /**
   * Accepts integral JSON numbers only. Fractions, strings and booleans yield {@code null}, as
   * do values outside the int range.
   */
  static Integer positiveInt(Object value) {
    if (value instanceof Integer i) {
      return i > 0 ? i : null;
    }
    if (value instanceof Long l) {
      return l > 0 && l <= Integer.MAX_VALUE ? l.intValue() : null;
    }
    if (value instanceof Short || value instanceof Byte) {
      int v = ((Number) value).intValue();
      return v > 0 ? v : null;
    }
    return null;
  }
}
