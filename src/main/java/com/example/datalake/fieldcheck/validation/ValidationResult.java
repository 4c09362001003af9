package com.example.datalake.fieldcheck.validation;

/**
 * Outcome of a single validation: the (possibly normalized) value and the translated error, or
 * {@code null} when the value passed.
 */
public record ValidationResult(Object value, String error) {

  public static ValidationResult valid(Object value) {
    return new ValidationResult(value, null);
  }

  public static ValidationResult invalid(Object value, String error) {
    if (error == null) {
      throw new IllegalArgumentException("error must not be null for a failed validation");
    }
    return new ValidationResult(value, error);
  }

  public boolean isValid() {
    return error == null;
  }
}
