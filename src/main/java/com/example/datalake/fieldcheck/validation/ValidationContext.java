package com.example.datalake.fieldcheck.validation;

import java.util.Objects;

/**
 * Request scoped state handed to every validator call: the translation hook, the fallback
 * message for validators built without one, and the id of the record currently being edited
 * (if any).
 */
public class ValidationContext {

  public static final String DEFAULT_MESSAGE = "Invalid value";

  private static final ValidationContext EMPTY =
      new ValidationContext(MessageTranslator.identity(), DEFAULT_MESSAGE, null);

  private final MessageTranslator translator;
  private final String defaultMessage;
  private final Object editingRecordId;

  public ValidationContext(MessageTranslator translator, String defaultMessage, Object editingRecordId) {
    this.translator = translator == null ? MessageTranslator.identity() : translator;
    this.defaultMessage =
        defaultMessage == null || defaultMessage.isBlank() ? DEFAULT_MESSAGE : defaultMessage;
    this.editingRecordId = editingRecordId;
  }

  public static ValidationContext empty() {
    return EMPTY;
  }

  public static ValidationContext editing(Object recordId) {
    return new ValidationContext(MessageTranslator.identity(), DEFAULT_MESSAGE, recordId);
  }

  /** Copy of this context exempting the given record from uniqueness checks. */
  public ValidationContext withEditingRecordId(Object recordId) {
    return new ValidationContext(translator, defaultMessage, recordId);
  }

  public MessageTranslator getTranslator() {
    return translator;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  public Object getEditingRecordId() {
    return editingRecordId;
  }

  /** Translates {@code message}, falling back to the default message when it is null. */
  public String translate(String message) {
    String source = Objects.requireNonNullElse(message, defaultMessage);
    return Objects.requireNonNullElse(translator.translate(source), source);
  }
}
