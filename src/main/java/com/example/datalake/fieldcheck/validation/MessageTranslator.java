package com.example.datalake.fieldcheck.validation;

/** Hook through which validators pass every user facing message before returning it. */
@FunctionalInterface
public interface MessageTranslator {

  String translate(String message);

  static MessageTranslator identity() {
    return message -> message;
  }
}
