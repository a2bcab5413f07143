package com.example.datalake.thinking.validation;

/** Identifies when a validator runs relative to the others. */
public enum ValidationStage {
  /** Checks on the fields every thought must carry. */
  REQUIRED_FIELDS,
  /** Parsing of the optional revision and branch context. */
  OPTIONAL_FIELDS
}
