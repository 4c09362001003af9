package com.example.datalake.fieldcheck.validation;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * One end of a range. Either a fixed value or a supplier evaluated on every check, which allows
 * bounds such as "now". A bound resolving to {@code null} leaves that end open.
 */
public interface Bound<T> {

  T resolve();

  static <T> Bound<T> none() {
    return new Literal<>(null);
  }

  static <T> Bound<T> literal(T value) {
    return new Literal<>(value);
  }

  static <T> Bound<T> deferred(Supplier<? extends T> supplier) {
    return new Deferred<>(supplier);
  }

  record Literal<T>(T value) implements Bound<T> {

    @Override
    public T resolve() {
      return value;
    }
  }

  record Deferred<T>(Supplier<? extends T> supplier) implements Bound<T> {

    public Deferred {
      Objects.requireNonNull(supplier, "supplier");
    }

    @Override
    public T resolve() {
      return supplier.get();
    }
  }
}
