package com.example.datalake.fieldcheck.validation;

/**
 * Whether a choice field accepts one value or a list, and optionally how many list entries.
 * {@link #between(int, int)} accepts counts in {@code [min, max)}.
 */
public final class Multiplicity {

  private static final Multiplicity SINGLE = new Multiplicity(false, null, null);
  private static final Multiplicity UNBOUNDED = new Multiplicity(true, null, null);

  private final boolean multiple;
  private final Integer min;
  private final Integer max;

  private Multiplicity(boolean multiple, Integer min, Integer max) {
    this.multiple = multiple;
    this.min = min;
    this.max = max;
  }

  public static Multiplicity single() {
    return SINGLE;
  }

  public static Multiplicity unbounded() {
    return UNBOUNDED;
  }

  public static Multiplicity between(int min, int max) {
    if (min < 0 || max < min) {
      throw new IllegalArgumentException("invalid cardinality [" + min + ", " + max + ")");
    }
    return new Multiplicity(true, min, max);
  }

  public boolean isMultiple() {
    return multiple;
  }

  public boolean isBounded() {
    return min != null;
  }

  public boolean accepts(int count) {
    if (!isBounded()) {
      return true;
    }
    return min <= count && count < max;
  }

  @Override
  public String toString() {
    if (!multiple) {
      return "single";
    }
    return isBounded() ? "multiple[" + min + ", " + max + ")" : "multiple";
  }
}
