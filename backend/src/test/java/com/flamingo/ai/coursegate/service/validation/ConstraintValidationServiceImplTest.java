package com.flamingo.ai.coursegate.service.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.enums.UnitType;
import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import com.flamingo.ai.coursegate.domain.model.Violation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConstraintValidationServiceImplTest {

  private SimpleMeterRegistry meterRegistry;
  private ConstraintValidationServiceImpl validationService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    validationService =
        new ConstraintValidationServiceImpl(PipelineConfigFixtures.standard(), meterRegistry);
  }

  private static ContentUnit unit(String id, String header, String body) {
    Map<String, String> fields = new LinkedHashMap<>();
    if (header != null) {
      fields.put("header", header);
    }
    if (body != null) {
      fields.put("body", body);
    }
    return new ContentUnit(id, "cardio", UnitType.CONTENT, fields);
  }

  private static String lines(int count) {
    return IntStream.rangeClosed(1, count)
        .mapToObj(i -> "Line " + i)
        .collect(Collectors.joining("\n"));
  }

  private static String words(int count) {
    return IntStream.range(0, count).mapToObj(i -> "word").collect(Collectors.joining(" "));
  }

  @Nested
  @DisplayName("Line limits")
  class LineLimits {

    @Test
    @DisplayName("should report one error citing 9 and 8 when body has 9 lines")
    void shouldReportOneError_whenBodyExceedsMaxLines() {
      // Given
      ContentUnit unit = unit("slide-1", "Heart failure", lines(9));

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).hasSize(1);
      Violation violation = violations.get(0);
      assertThat(violation.rule()).isEqualTo(RuleType.LINE_LIMIT);
      assertThat(violation.severity()).isEqualTo(Severity.ERROR);
      assertThat(violation.measured()).isEqualTo(9);
      assertThat(violation.limit()).isEqualTo(8);
      assertThat(violation.location()).isEqualTo("slide-1/body");
      assertThat(violation.message()).contains("9").contains("8");
    }

    @Test
    @DisplayName("should pass when body is exactly at the line limit")
    void shouldPass_whenBodyAtLimit() {
      // Given
      ContentUnit unit = unit("slide-1", "Heart failure", lines(8));

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).isEmpty();
    }

    @Test
    @DisplayName("should ignore blank lines when counting")
    void shouldIgnoreBlankLines() {
      // Given
      ContentUnit unit = unit("slide-1", "Heart failure", lines(8) + "\n\n   \n");

      // When / Then
      assertThat(validationService.validate(unit)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Character limits")
  class CharacterLimits {

    @Test
    @DisplayName("should locate the offending line")
    void shouldLocateOffendingLine() {
      // Given
      String body = "short line\n" + "x".repeat(67);
      ContentUnit unit = unit("slide-2", "Header", body);

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).singleElement()
          .satisfies(
              v -> {
                assertThat(v.rule()).isEqualTo(RuleType.CHAR_LIMIT);
                assertThat(v.location()).isEqualTo("slide-2/body:line 2");
                assertThat(v.measured()).isEqualTo(67);
                assertThat(v.limit()).isEqualTo(66);
              });
    }

    @Test
    @DisplayName("should accept a line of exactly the maximum length")
    void shouldAcceptLineAtLimit() {
      // Given
      ContentUnit unit = unit("slide-2", "x".repeat(32), "x".repeat(66));

      // When / Then
      assertThat(validationService.validate(unit)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Required fields")
  class RequiredFields {

    @Test
    @DisplayName("should report a missing required field")
    void shouldReportMissingField() {
      // Given
      ContentUnit unit = unit("slide-3", "Header", null);

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).singleElement()
          .satisfies(
              v -> {
                assertThat(v.rule()).isEqualTo(RuleType.REQUIRED_FIELD);
                assertThat(v.severity()).isEqualTo(Severity.ERROR);
                assertThat(v.field()).isEqualTo("body");
                assertThat(v.message()).contains("missing");
              });
    }

    @Test
    @DisplayName("should report a blank required field")
    void shouldReportBlankField() {
      // Given
      ContentUnit unit = unit("slide-3", "   ", "Body");

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).extracting(Violation::message).containsExactly(
          "required field 'header' is blank");
    }

    @Test
    @DisplayName("should not require fields for a unit without a type")
    void shouldNotRequireFields_whenTypeMissing() {
      // Given
      ContentUnit unit = new ContentUnit("loose", "cardio", null, Map.of("tip", "Check pulse"));

      // When / Then
      assertThat(validationService.validate(unit)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Notes")
  class Notes {

    @Test
    @DisplayName("should warn when the pause marker is missing")
    void shouldWarn_whenMarkerMissing() {
      // Given
      ContentUnit unit =
          new ContentUnit(
              "slide-4",
              "cardio",
              UnitType.CONTENT,
              Map.of("header", "H", "body", "B", "notes", "Talk about preload."));

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).singleElement()
          .satisfies(
              v -> {
                assertThat(v.rule()).isEqualTo(RuleType.MARKER_MINIMUM);
                assertThat(v.severity()).isEqualTo(Severity.WARNING);
                assertThat(v.measured()).isZero();
                assertThat(v.limit()).isEqualTo(1);
              });
    }

    @Test
    @DisplayName("should match the marker case-insensitively and not count it as a word")
    void shouldMatchMarkerCaseInsensitively() {
      // Given
      ContentUnit unit =
          new ContentUnit(
              "slide-4",
              "cardio",
              UnitType.CONTENT,
              Map.of("header", "H", "body", "B", "notes", words(450) + " [pause]"));

      // When / Then
      assertThat(validationService.validate(unit)).isEmpty();
    }

    @Test
    @DisplayName("should report notes above the word maximum")
    void shouldReportTooManyWords() {
      // Given
      ContentUnit unit =
          new ContentUnit(
              "slide-4",
              "cardio",
              UnitType.CONTENT,
              Map.of("header", "H", "body", "B", "notes", words(451) + " [PAUSE]"));

      // When
      List<Violation> violations = validationService.validate(unit);

      // Then
      assertThat(violations).singleElement()
          .satisfies(
              v -> {
                assertThat(v.rule()).isEqualTo(RuleType.WORD_MAXIMUM);
                assertThat(v.measured()).isEqualTo(451);
                assertThat(v.limit()).isEqualTo(450);
              });
    }
  }

  @Test
  @DisplayName("should aggregate a batch and count violations by rule and field")
  void shouldAggregateBatch() {
    // Given
    List<ContentUnit> units =
        List.of(
            unit("slide-1", "Header", lines(9)),
            unit("slide-2", "Header", "Body"),
            unit("slide-3", "Header", null));

    // When
    ValidationResult result = validationService.validateAll(units);

    // Then
    assertThat(result.unitsChecked()).isEqualTo(3);
    assertThat(result.unitsWithErrors()).isEqualTo(2);
    assertThat(result.errorCount()).isEqualTo(2);
    assertThat(result.hasErrors()).isTrue();
    assertThat(result.countsByRule())
        .containsEntry(RuleType.LINE_LIMIT, 1L)
        .containsEntry(RuleType.REQUIRED_FIELD, 1L);
    assertThat(result.countsByField()).containsEntry("body", 2L);
    assertThat(meterRegistry.counter("validation.violations", "rule", "LINE_LIMIT").count())
        .isEqualTo(1.0);
  }
}
