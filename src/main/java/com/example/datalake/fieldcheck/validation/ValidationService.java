package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.config.FieldCheckProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the validator chain of a field: each validator receives the value returned by the
 * previous one and the chain stops at the first error.
 */
@Slf4j
@Service
public class ValidationService {

  private final MessageTranslator translator;
  private final String defaultMessage;

  public ValidationService(MessageTranslator translator, FieldCheckProperties properties) {
    this.translator = translator == null ? MessageTranslator.identity() : translator;
    this.defaultMessage = properties == null ? null : properties.getDefaultMessage();
  }

  public ValidationContext newContext() {
    return newContext(null);
  }

  /** Context for an update flow: the given record is exempt from uniqueness checks. */
  public ValidationContext newContext(Object editingRecordId) {
    return new ValidationContext(translator, defaultMessage, editingRecordId);
  }

  public ValidationResult validate(Object value, List<? extends FieldValidator> validators) {
    return validate(value, validators, newContext());
  }

  public ValidationResult validate(
      Object value, List<? extends FieldValidator> validators, ValidationContext context) {
    Objects.requireNonNull(context, "context");
    Object current = value;
    if (validators == null) {
      return ValidationResult.valid(current);
    }
    for (FieldValidator validator : validators) {
      if (validator == null) {
        continue;
      }
      ValidationResult result = validator.validate(current, context);
      if (!result.isValid()) {
        log.debug("[validation] {} rejected {}: {}", validator.getClass().getSimpleName(), current, result.error());
        return result;
      }
      current = result.value();
    }
    return ValidationResult.valid(current);
  }

  /** Same as {@link #validate(Object, List, ValidationContext)} but raises on failure. */
  public Object validateOrThrow(
      Object value, List<? extends FieldValidator> validators, ValidationContext context) {
    ValidationResult result = validate(value, validators, context);
    if (!result.isValid()) {
      throw new ValidationException(result.value(), result.error());
    }
    return result.value();
  }

  /**
   * Validates several fields at once. Fields without a chain pass unchanged; the result keeps
   * the iteration order of {@code values}.
   */
  public Map<String, ValidationResult> validateForm(
      Map<String, ?> values,
      Map<String, ? extends List<? extends FieldValidator>> chains,
      ValidationContext context) {
    Map<String, ValidationResult> results = new LinkedHashMap<>();
    if (values == null) {
      return results;
    }
    Map<String, ? extends List<? extends FieldValidator>> safeChains =
        chains == null ? Collections.emptyMap() : chains;
    values.forEach((name, value) -> results.put(name, validate(value, safeChains.get(name), context)));
    return results;
  }

  /**
   * Returns the normalized field values, or raises one {@link ValidationException} carrying the
   * error of every failing field.
   */
  public Map<String, Object> validateFormOrThrow(
      Map<String, ?> values,
      Map<String, ? extends List<? extends FieldValidator>> chains,
      ValidationContext context) {
    Map<String, ValidationResult> results = validateForm(values, chains, context);
    Map<String, Object> accepted = new LinkedHashMap<>();
    Map<String, String> errors = new LinkedHashMap<>();
    results.forEach((name, result) -> {
      if (result.isValid()) {
        accepted.put(name, result.value());
      } else {
        errors.put(name, result.error());
      }
    });
    if (!errors.isEmpty()) {
      throw new ValidationException(values, errors);
    }
    return accepted;
  }
}
