package com.example.datalake.fieldcheck.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.datalake.fieldcheck.config.FieldCheckProperties;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValidationServiceTest {

  private final FieldCheckProperties properties = new FieldCheckProperties();
  private final ValidationService service =
      new ValidationService(MessageTranslator.identity(), properties);

  @Test
  void shouldFeedEachValidatorTheValueReturnedByThePreviousOne() {
    InSetValidator tags = InSetValidator.builder()
        .theset(List.of("a", "b", "c"))
        .multiple(Multiplicity.unbounded())
        .build();
    FieldValidator atMostTwo = (value, context) -> ((List<?>) value).size() <= 2
        ? ValidationResult.valid(value)
        : ValidationResult.invalid(value, context.translate("Too many"));

    ValidationResult single = service.validate("a", List.of(tags, atMostTwo));
    ValidationResult tooMany = service.validate(List.of("a", "b", "c"), List.of(tags, atMostTwo));

    assertThat(single.value()).isEqualTo(List.of("a"));
    assertThat(single.isValid()).isTrue();
    assertThat(tooMany.error()).isEqualTo("Too many");
  }

  @Test
  void shouldStopAtFirstFailure() {
    FieldValidator never = mock(FieldValidator.class);

    ValidationResult result = service.validate(50, List.of(InRangeValidator.between(1, 10), never));

    assertThat(result.error()).isEqualTo("Enter a value between 1 and 9");
    verifyNoInteractions(never);
  }

  @Test
  void shouldSkipNullValidatorsAndPassWithoutChain() {
    assertThat(service.validate("x", Arrays.asList(null, InSetValidator.of("x"))).isValid()).isTrue();
    assertThat(service.validate("x", null).value()).isEqualTo("x");
  }

  @Test
  void shouldCarryEditingRecordIdAndDefaultMessageInContext() {
    FieldValidator validator = mock(FieldValidator.class);
    when(validator.validate(any(), any())).thenAnswer(invocation -> {
      ValidationContext context = invocation.getArgument(1);
      return ValidationResult.invalid(
          invocation.getArgument(0), context.translate(null) + " #" + context.getEditingRecordId());
    });
    properties.setDefaultMessage("Not allowed");
    ValidationService configured = new ValidationService(MessageTranslator.identity(), properties);

    ValidationResult result = configured.validate("v", List.of(validator), configured.newContext(42L));

    assertThat(result.error()).isEqualTo("Not allowed #42");
  }

  @Test
  void shouldTranslateWithConfiguredTranslator() {
    ValidationService translating =
        new ValidationService(message -> message.toUpperCase(), properties);

    ValidationResult result = translating.validate("z", List.of(InSetValidator.of("a")));

    assertThat(result.error()).isEqualTo("INVALID VALUE");
  }

  @Test
  void shouldRaiseValidationExceptionOnFailure() {
    ValidationContext context = service.newContext();

    assertThat(service.validateOrThrow("b", List.of(InSetValidator.of("a", "b")), context)).isEqualTo("b");
    assertThatThrownBy(() -> service.validateOrThrow("z", List.of(InSetValidator.of("a")), context))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Invalid value")
        .isInstanceOfSatisfying(
            ValidationException.class, ex -> assertThat(ex.getValue()).isEqualTo("z"));
  }

  @Test
  void shouldValidateEveryFieldOfAForm() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("age", 130);
    values.put("color", "red");
    values.put("note", "free text");
    Map<String, List<FieldValidator>> chains = Map.of(
        "age", List.of(InRangeValidator.between(0, 120)),
        "color", List.of(InSetValidator.of("red", "green")));

    Map<String, ValidationResult> results = service.validateForm(values, chains, service.newContext());

    assertThat(results).containsOnlyKeys("age", "color", "note");
    assertThat(results.get("age").error()).isEqualTo("Enter a value between 0 and 119");
    assertThat(results.get("color").isValid()).isTrue();
    assertThat(results.get("note").value()).isEqualTo("free text");
  }

  @Test
  void shouldCollectEveryFailingFieldIntoOneException() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("age", -1);
    values.put("color", "blue");
    Map<String, List<FieldValidator>> chains = Map.of(
        "age", List.of(InRangeValidator.between(0, 120)),
        "color", List.of(InSetValidator.of("red", "green")));

    assertThatThrownBy(() -> service.validateFormOrThrow(values, chains, service.newContext()))
        .isInstanceOfSatisfying(ValidationException.class, ex -> assertThat(ex.getFieldErrors())
            .containsExactly(
                Map.entry("age", "Enter a value between 0 and 119"),
                Map.entry("color", "Invalid value")));
  }

  @Test
  void shouldReturnNormalizedValuesWhenFormIsValid() {
    Map<String, Object> values = Map.of("tags", "a");
    Map<String, List<FieldValidator>> chains = Map.of("tags", List.of(InSetValidator.builder()
        .theset(List.of("a", "b"))
        .multiple(Multiplicity.unbounded())
        .build()));

    Map<String, Object> accepted = service.validateFormOrThrow(values, chains, service.newContext());

    assertThat(accepted).containsEntry("tags", List.of("a"));
  }
}
