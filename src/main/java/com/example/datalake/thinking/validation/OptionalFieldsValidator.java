package com.example.datalake.thinking.validation;

import org.springframework.stereotype.Component;

/**
 * Copies the optional revision and branch context onto the record. A field of the wrong type is
 * treated as absent and reported as a notice, never as an error.
 */
@Component
public class OptionalFieldsValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.OPTIONAL_FIELDS;
  }

  @Override
  public void validate(ValidationContext context) {
    context.record()
        .revision(flag(context, "isRevision"))
        .revisesSequence(number(context, "revisesSequence"))
        .branchOrigin(number(context, "branchOrigin"))
        .branchId(text(context, "branchId"))
        .needsMoreThoughts(flag(context, "needsMoreThoughts"));
  }

  private static Boolean flag(ValidationContext context, String name) {
    Object value = context.argument(name);
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    ignored(context, name, "a boolean");
    return null;
  }

  private static Integer number(ValidationContext context, String name) {
    Object value = context.argument(name);
    if (value == null) {
      return null;
    }
    Integer parsed = SequenceFieldsValidator.positiveInt(value);
    if (parsed == null) {
      ignored(context, name, "a positive integer");
    }
    return parsed;
  }

  private static String text(ValidationContext context, String name) {
    Object value = context.argument(name);
    if (value == null) {
      return null;
    }
    if (value instanceof String s && !s.isBlank()) {
      return s;
    }
    ignored(context, name, "a non-blank string");
    return null;
  }

  private static void ignored(ValidationContext context, String name, String expected) {
    context.addNotice("Ignored " + name + ": expected " + expected);
  }
}
