package com.example.datalake.fieldcheck.validation;

import com.example.datalake.fieldcheck.util.RowFormatUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Checks that a comparable value lies between an optional minimum and maximum. By default the
 * minimum is inclusive and the maximum exclusive.
 *
 * <p>Custom messages may reference the resolved bounds as {@code {min}} and {@code {max}}. An
 * integral maximum is displayed decremented by one.
 */
public class InRangeValidator<T extends Comparable<? super T>> implements FieldValidator {

  private final Bound<T> minimum;
  private final Bound<T> maximum;
  private final boolean includeMin;
  private final boolean includeMax;
  private final String message;

  public InRangeValidator(
      Bound<T> minimum, Bound<T> maximum, boolean includeMin, boolean includeMax, String message) {
    this.minimum = minimum == null ? Bound.none() : minimum;
    this.maximum = maximum == null ? Bound.none() : maximum;
    this.includeMin = includeMin;
    this.includeMax = includeMax;
    this.message = message;
  }

  public static <T extends Comparable<? super T>> InRangeValidator<T> of(Bound<T> minimum, Bound<T> maximum) {
    return new InRangeValidator<>(minimum, maximum, true, false, null);
  }

  public static <T extends Comparable<? super T>> InRangeValidator<T> between(T minimum, T maximum) {
    return of(Bound.literal(minimum), Bound.literal(maximum));
  }

  public static <T extends Comparable<? super T>> InRangeValidator<T> atLeast(T minimum) {
    return of(Bound.literal(minimum), Bound.none());
  }

  public static <T extends Comparable<? super T>> InRangeValidator<T> below(T maximum) {
    return of(Bound.none(), Bound.literal(maximum));
  }

  public InRangeValidator<T> inclusive(boolean includeMin, boolean includeMax) {
    return new InRangeValidator<>(minimum, maximum, includeMin, includeMax, message);
  }

  public InRangeValidator<T> withMessage(String message) {
    return new InRangeValidator<>(minimum, maximum, includeMin, includeMax, message);
  }

  @Override
  public ValidationResult validate(Object value, ValidationContext context) {
    T min = minimum.resolve();
    T max = maximum.resolve();
    // comparability only matters against a present bound
    boolean comparable = value instanceof Comparable<?>;
    boolean minOk = min == null || (comparable && greaterThan(value, min, includeMin));
    boolean maxOk = max == null || (comparable && lessThan(value, max, includeMax));
    if (minOk && maxOk) {
      return ValidationResult.valid(value);
    }
    return ValidationResult.invalid(value, rangeError(context, min, max));
  }

  private String rangeError(ValidationContext context, T min, T max) {
    String template = message;
    if (template == null) {
      StringBuilder sb = new StringBuilder("Enter a value");
      if (min != null && max != null) {
        sb.append(" between {min} and {max}");
      } else if (min != null) {
        sb.append(" greater than or equal to {min}");
      } else if (max != null) {
        sb.append(" less than or equal to {max}");
      }
      template = sb.toString();
    }
    String translated = context.translate(template);
    translated = RowFormatUtils.substitute(translated, "min", min);
    return RowFormatUtils.substitute(translated, "max", displayedMaximum(max));
  }

  // integral maxima are shown as the last accepted value of an exclusive range
  private static Object displayedMaximum(Object max) {
    if (max instanceof Integer i) {
      return i - 1;
    }
    if (max instanceof Long l) {
      return l - 1;
    }
    if (max instanceof Short s) {
      return s - 1;
    }
    if (max instanceof Byte b) {
      return b - 1;
    }
    if (max instanceof BigInteger big) {
      return big.subtract(BigInteger.ONE);
    }
    return max;
  }

  private static boolean greaterThan(Object value, Object bound, boolean orEqual) {
    int cmp = compare(value, bound);
    return orEqual ? cmp >= 0 : cmp > 0;
  }

  private static boolean lessThan(Object value, Object bound, boolean orEqual) {
    int cmp = compare(value, bound);
    return orEqual ? cmp <= 0 : cmp < 0;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object value, Object bound) {
    Objects.requireNonNull(bound, "bound");
    if (value instanceof Number a && bound instanceof Number b && a.getClass() != b.getClass()) {
      if (isFloating(a) || isFloating(b)) {
        return Double.compare(a.doubleValue(), b.doubleValue());
      }
      return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
    }
    return ((Comparable) value).compareTo(bound);
  }

  private static boolean isFloating(Number n) {
    return n instanceof Double || n instanceof Float;
  }
}
