package com.example.datalake.fieldcheck.validation;

/** Contract for a single field check. Failures are returned, never thrown. */
public interface FieldValidator {

  /** Checks {@code value} and returns it, possibly normalized, together with any error. */
  ValidationResult validate(Object value, ValidationContext context);

  default ValidationResult validate(Object value) {
    return validate(value, ValidationContext.empty());
  }
}
