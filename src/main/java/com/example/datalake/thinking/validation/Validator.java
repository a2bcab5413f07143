package com.example.datalake.thinking.validation;

/** Contract for one validation step applied to a submitted thought. */
public interface Validator {

  /** The stage in which the validator should be executed. */
  ValidationStage stage();

  /**
   * Inspects the raw arguments, records parsed values on the context's record builder and
   * reports problems through {@link ValidationContext#reject(String)}. Must not throw for bad
   * input.
   */
  void validate(ValidationContext context);
}
