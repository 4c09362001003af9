package com.example.datalake.fieldcheck.validation;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InRangeValidatorTest {

  @Test
  void shouldAcceptValuesFromInclusiveMinimumUpToExclusiveMaximum() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10);

    for (int v = 1; v < 10; v++) {
      ValidationResult result = validator.validate(v);
      assertThat(result.isValid()).as("value %d", v).isTrue();
      assertThat(result.value()).isEqualTo(v);
    }
    assertThat(validator.validate(10).isValid()).isFalse();
    assertThat(validator.validate(0).isValid()).isFalse();
  }

  @Test
  void shouldShowIntegerMaximumDecrementedByOne() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10);

    assertThat(validator.validate(42).error()).isEqualTo("Enter a value between 1 and 9");
    assertThat(validator.validate(-3).error()).contains("9");
  }

  @Test
  void shouldKeepDecrementedDisplayEvenWhenMaximumIsInclusive() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10).inclusive(true, true);

    for (int v = 1; v <= 10; v++) {
      assertThat(validator.validate(v).isValid()).as("value %d", v).isTrue();
    }
    assertThat(validator.validate(11).error()).isEqualTo("Enter a value between 1 and 9");
  }

  @Test
  void shouldRejectMinimumWhenExclusive() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10).inclusive(false, false);

    assertThat(validator.validate(1).isValid()).isFalse();
    assertThat(validator.validate(2).isValid()).isTrue();
  }

  @Test
  void shouldDescribeOneSidedRanges() {
    assertThat(InRangeValidator.atLeast(5).validate(4).error())
        .isEqualTo("Enter a value greater than or equal to 5");
    assertThat(InRangeValidator.below(10).validate(12).error())
        .isEqualTo("Enter a value less than or equal to 9");
  }

  @Test
  void shouldNotDecrementNonIntegralMaximum() {
    InRangeValidator<Double> validator = InRangeValidator.between(0.5, 2.5);

    assertThat(validator.validate(2.0).isValid()).isTrue();
    assertThat(validator.validate(3.0).error()).isEqualTo("Enter a value between 0.5 and 2.5");
  }

  @Test
  void shouldResolveDeferredBoundsOnEveryCheck() {
    AtomicInteger calls = new AtomicInteger();
    LocalDate today = LocalDate.of(2026, 10, 19);
    InRangeValidator<LocalDate> notInFuture =
        InRangeValidator.<LocalDate>of(Bound.none(), Bound.deferred(() -> {
          calls.incrementAndGet();
          return today;
        })).inclusive(true, true);

    assertThat(notInFuture.validate(today.minusDays(1)).isValid()).isTrue();
    assertThat(notInFuture.validate(today.plusDays(1)).error())
        .isEqualTo("Enter a value less than or equal to 2026-10-19");
    assertThat(calls).hasValue(2);
  }

  @Test
  void shouldSubstituteBoundsIntoCustomMessage() {
    InRangeValidator<Integer> validator =
        InRangeValidator.between(1, 10).withMessage("Pick a number from {min} to {max}");

    assertThat(validator.validate(20).error()).isEqualTo("Pick a number from 1 to 9");
  }

  @Test
  void shouldTranslateBeforeSubstituting() {
    ValidationContext context = new ValidationContext(
        message -> message.replace("Enter a value between", "Inserire un valore tra")
            .replace(" and ", " e "),
        null,
        null);

    ValidationResult result = InRangeValidator.between(1, 10).validate(0, context);

    assertThat(result.error()).isEqualTo("Inserire un valore tra 1 e 9");
  }

  @Test
  void shouldCompareAcrossNumericTypes() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10);

    assertThat(validator.validate(5L).isValid()).isTrue();
    assertThat(validator.validate(9.5).isValid()).isTrue();
    assertThat(validator.validate(10.0).isValid()).isFalse();
  }

  @Test
  void shouldRejectNullValue() {
    ValidationResult result = InRangeValidator.between(1, 10).validate(null);

    assertThat(result.isValid()).isFalse();
    assertThat(result.value()).isNull();
  }

  @Test
  void shouldPassAnythingComparableWhenUnbounded() {
    InRangeValidator<String> validator = InRangeValidator.<String>of(Bound.none(), Bound.none());

    assertThat(validator.validate("anything").isValid()).isTrue();
  }

  @Test
  void shouldPassAnyValueWhenNoBoundIsSet() {
    InRangeValidator<Integer> validator = InRangeValidator.<Integer>of(Bound.none(), Bound.none());

    assertThat(validator.validate(null)).isEqualTo(ValidationResult.valid(null));
    assertThat(validator.validate(List.of(1)).isValid()).isTrue();
  }

  @Test
  void shouldPassNullWhenDeferredBoundsResolveToNull() {
    InRangeValidator<Integer> validator =
        InRangeValidator.<Integer>of(Bound.deferred(() -> null), Bound.deferred(() -> null));

    assertThat(validator.validate(null).isValid()).isTrue();
  }

  @Test
  void shouldRejectNonComparableValueWhenBounded() {
    ValidationResult result = InRangeValidator.atLeast(1).validate(List.of(1));

    assertThat(result.error()).isEqualTo("Enter a value greater than or equal to 1");
  }

  @Test
  void shouldReturnIdenticalResultsForRepeatedChecks() {
    InRangeValidator<Integer> validator = InRangeValidator.between(1, 10);

    assertThat(validator.validate(15)).isEqualTo(validator.validate(15));
    assertThat(validator.validate(5)).isEqualTo(validator.validate(5));
  }
}
