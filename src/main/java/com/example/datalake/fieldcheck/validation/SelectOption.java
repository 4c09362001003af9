package com.example.datalake.fieldcheck.validation;

/** A {@code (key, label)} pair offered to a form when rendering a choice field. */
public record SelectOption(Object key, String label) {

  public static SelectOption of(Object key, String label) {
    return new SelectOption(key, label);
  }
}
