package com.example.datalake.fieldcheck.validation;

import lombok.Builder;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks that a value (or, in multiple mode, every value of a list) is one of a fixed set of
 * allowed items. Items are compared by their string form.
 */
public class InSetValidator implements FieldValidator {

  /** Case-insensitive ordering by label, used when {@code sort} is enabled without a sorter. */
  public static final Comparator<SelectOption> LABEL_ORDER =
      Comparator.comparing(option -> String.valueOf(option.label()).toUpperCase(Locale.ROOT));

  private final List<String> theset;
  private final List<String> labels;
  private final Multiplicity multiple;
  private final String zero;
  private final Comparator<SelectOption> sorter;
  private final String message;

  /**
   * @param theset allowed items, ignored when {@code choices} is given
   * @param labels display labels parallel to {@code theset}, may be null
   * @param choices ordered item to label pairs, split into items and labels
   * @param multiple single value or list mode, defaults to single
   * @param zero label of the leading empty option, may be null
   * @param sort whether {@link #options(boolean)} orders options by label
   * @param sorter custom option ordering, implies {@code sort}
   * @param message failure message, defaults to the context's default message
   */
  @Builder
  private InSetValidator(
      Collection<?> theset,
      List<String> labels,
      Map<?, ?> choices,
      Multiplicity multiple,
      String zero,
      boolean sort,
      Comparator<SelectOption> sorter,
      String message) {
    List<String> items = new ArrayList<>();
    List<String> itemLabels = null;
    if (choices != null) {
      itemLabels = new ArrayList<>();
      for (Map.Entry<?, ?> entry : choices.entrySet()) {
        items.add(String.valueOf(entry.getKey()));
        itemLabels.add(String.valueOf(entry.getValue()));
      }
    } else if (theset != null) {
      for (Object item : theset) {
        items.add(String.valueOf(item));
      }
      if (labels != null && !labels.isEmpty()) {
        if (labels.size() != items.size()) {
          throw new IllegalArgumentException(
              "labels must match theset in size: " + labels.size() + " != " + items.size());
        }
        itemLabels = new ArrayList<>(labels);
      }
    }
    this.theset = List.copyOf(items);
    this.labels = itemLabels == null ? null : Collections.unmodifiableList(itemLabels);
    this.multiple = multiple == null ? Multiplicity.single() : multiple;
    this.zero = zero;
    this.sorter = sorter != null ? sorter : (sort ? LABEL_ORDER : null);
    this.message = message;
  }

  public static InSetValidator of(Collection<?> theset) {
    return builder().theset(theset).build();
  }

  public static InSetValidator of(Object... theset) {
    return of(Arrays.asList(theset));
  }

  public List<String> getTheset() {
    return theset;
  }

  public Multiplicity getMultiple() {
    return multiple;
  }

  /**
   * Options for rendering this field, in declaration order unless sorting was requested.
   *
   * @param includeZero whether to prepend the {@code ("", zero)} option when a zero label is set
   */
  public List<SelectOption> options(boolean includeZero) {
    List<SelectOption> items = new ArrayList<>(theset.size() + 1);
    for (int i = 0; i < theset.size(); i++) {
      String key = theset.get(i);
      items.add(new SelectOption(key, labels == null ? key : labels.get(i)));
    }
    if (sorter != null) {
      items.sort(sorter);
    }
    if (includeZero && zero != null && !multiple.isMultiple()) {
      items.add(0, new SelectOption("", zero));
    }
    return items;
  }

  public List<SelectOption> options() {
    return options(true);
  }

  @Override
  public ValidationResult validate(Object value, ValidationContext context) {
    List<?> values = multiple.isMultiple() ? asList(value) : Collections.singletonList(value);
    boolean failed = false;
    for (Object item : values) {
      if (!theset.contains(String.valueOf(item))) {
        failed = true;
        break;
      }
    }
    // a blank value in multiple mode normalizes to an empty selection and never fails here
    if (failed && !theset.isEmpty()) {
      return ValidationResult.invalid(value, context.translate(message));
    }
    if (multiple.isMultiple()) {
      if (!multiple.accepts(values.size())) {
        return ValidationResult.invalid(values, context.translate(message));
      }
      return ValidationResult.valid(values);
    }
    return ValidationResult.valid(value);
  }

  private static boolean isBlank(Object value) {
    return value == null || "".equals(value);
  }

  static List<?> asList(Object value) {
    if (isBlank(value)) {
      return List.of();
    }
    return elements(value);
  }

  /** A collection or array as a list of its elements, any other value as a singleton list. */
  static List<?> elements(Object value) {
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    if (value != null && value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> items = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        items.add(Array.get(value, i));
      }
      return items;
    }
    return Collections.singletonList(value);
  }

  @Override
  public String toString() {
    return "InSetValidator" + theset + "(" + multiple + ")";
  }
}
