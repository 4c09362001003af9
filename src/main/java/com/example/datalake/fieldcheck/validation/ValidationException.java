package com.example.datalake.fieldcheck.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thrown by {@link ValidationService} when a field, or one or more fields of a form, fail their
 * validator chains. Form failures keep the error of every rejected field by name.
 */
public class ValidationException extends RuntimeException {

  private final Object value;
  private final Map<String, String> fieldErrors;

  /** Failure of a single value. */
  public ValidationException(Object value, String error) {
    super(Objects.requireNonNull(error, "error"));
    this.value = value;
    this.fieldErrors = Map.of();
  }

  /** Failure of a form; {@code fieldErrors} maps each rejected field to its error, in form order. */
  public ValidationException(Object value, Map<String, String> fieldErrors) {
    super(formatMessage(fieldErrors));
    this.value = value;
    this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
  }

  /** The rejected value (or the submitted form) as it stood when validation failed. */
  public Object getValue() {
    return value;
  }

  /** Errors by field name; empty for a single value failure. */
  public Map<String, String> getFieldErrors() {
    return fieldErrors;
  }

  public boolean isFormFailure() {
    return !fieldErrors.isEmpty();
  }

  /** Human readable reasons, one {@code "field: error"} per rejected field. */
  public List<String> getReasons() {
    if (fieldErrors.isEmpty()) {
      return List.of(getMessage());
    }
    return fieldErrors.entrySet().stream().map(e -> e.getKey() + ": " + e.getValue()).toList();
  }

  private static String formatMessage(Map<String, String> fieldErrors) {
    Objects.requireNonNull(fieldErrors, "fieldErrors");
    if (fieldErrors.isEmpty()) {
      throw new IllegalArgumentException("a form failure needs at least one field error");
    }
    StringBuilder sb = new StringBuilder();
    fieldErrors.forEach((field, error) -> {
      if (field == null || error == null) {
        throw new IllegalArgumentException("field errors must not contain null names or errors");
      }
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(field).append(": ").append(error);
    });
    return sb.toString();
  }
}
