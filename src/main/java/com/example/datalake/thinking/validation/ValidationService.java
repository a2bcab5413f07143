package com.example.datalake.thinking.validation;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link Validator} beans and executes them in stage order for a
 * submitted thought.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  public ValidationResult validate(Map<String, Object> arguments) {
    ValidationContext context = new ValidationContext(arguments);
    for (Validator validator : orderedValidators) {
      validator.validate(context);
    }
    if (context.hasErrors()) {
      return ValidationResult.invalid(context.getErrors(), context.getNotices());
    }
    return ValidationResult.valid(context.record().build(), context.getNotices());
  }
}
