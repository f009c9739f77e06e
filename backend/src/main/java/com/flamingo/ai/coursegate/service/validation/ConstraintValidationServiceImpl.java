package com.flamingo.ai.coursegate.service.validation;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.config.PipelineConfig.FieldLimits;
import com.flamingo.ai.coursegate.config.PipelineConfig.MarkerRequirement;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import com.flamingo.ai.coursegate.domain.model.Violation;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ConstraintValidationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConstraintValidationServiceImpl implements ConstraintValidationService {

  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public List<Violation> validate(ContentUnit unit) {
    return validate(unit, pipelineConfig.getLimits());
  }

  @Override
  public List<Violation> validate(ContentUnit unit, PipelineConfig.Limits limits) {
    Objects.requireNonNull(unit, "unit");
    List<Violation> violations = new ArrayList<>();

    List<String> required =
        unit.type() == null
            ? List.of()
            : limits.getRequiredFields().getOrDefault(unit.type(), List.of());

    // Required fields first, then every field that has limits or is present
    Set<String> fieldNames = new LinkedHashSet<>(required);
    fieldNames.addAll(unit.fields().keySet());

    for (String field : fieldNames) {
      String text = unit.field(field);
      boolean blank = text == null || text.isBlank();
      if (blank) {
        if (required.contains(field)) {
          violations.add(
              Violation.builder()
                  .location(unit.id() + "/" + field)
                  .rule(RuleType.REQUIRED_FIELD)
                  .severity(Severity.ERROR)
                  .message(
                      "required field '"
                          + field
                          + "' is "
                          + (text == null ? "missing" : "blank"))
                  .field(field)
                  .build());
        }
        continue;
      }
      FieldLimits fieldLimits = limits.getFields().get(field);
      if (fieldLimits != null) {
        checkField(unit.id(), field, text, fieldLimits, violations);
      }
    }

    violations.forEach(
        v -> meterRegistry.counter("validation.violations", "rule", v.rule().name()).increment());
    if (!violations.isEmpty()) {
      log.debug("Unit {} has {} violation(s)", unit.id(), violations.size());
    }
    return violations;
  }

  @Override
  @Timed(value = "validation.batch", description = "Time to validate a set of content units")
  public ValidationResult validateAll(List<ContentUnit> units) {
    List<Violation> all = new ArrayList<>();
    Map<String, Long> byField = new LinkedHashMap<>();
    Map<RuleType, Long> byRule = new EnumMap<>(RuleType.class);
    int unitsWithErrors = 0;

    for (ContentUnit unit : units) {
      List<Violation> violations = validate(unit);
      if (violations.stream().anyMatch(Violation::isError)) {
        unitsWithErrors++;
      }
      for (Violation violation : violations) {
        if (violation.field() != null) {
          byField.merge(violation.field(), 1L, Long::sum);
        }
        byRule.merge(violation.rule(), 1L, Long::sum);
      }
      all.addAll(violations);
    }

    log.info(
        "Validated {} unit(s): {} violation(s), {} unit(s) with errors",
        units.size(),
        all.size(),
        unitsWithErrors);
    return new ValidationResult(units.size(), unitsWithErrors, all, byField, byRule);
  }

  private void checkField(
      String unitId, String field, String text, FieldLimits limits, List<Violation> out) {
    String location = unitId + "/" + field;
    List<String> lines = TextMetrics.nonEmptyLines(text);

    if (limits.getMaxLines() != null && lines.size() > limits.getMaxLines()) {
      out.add(
          numeric(
                  location,
                  field,
                  RuleType.LINE_LIMIT,
                  Severity.ERROR,
                  lines.size(),
                  limits.getMaxLines())
              .message(
                  field + " has " + lines.size() + " lines (max " + limits.getMaxLines() + ")")
              .build());
    }

    if (limits.getMaxCharsPerLine() != null) {
      int max = limits.getMaxCharsPerLine();
      for (int i = 0; i < lines.size(); i++) {
        int chars = TextMetrics.charCount(lines.get(i));
        if (chars > max) {
          int lineNumber = i + 1;
          out.add(
              numeric(
                      location + ":line " + lineNumber,
                      field,
                      RuleType.CHAR_LIMIT,
                      Severity.ERROR,
                      chars,
                      max)
                  .message(
                      String.format(
                          "%s line %d has %d characters (max %d)", field, lineNumber, chars, max))
                  .build());
        }
      }
    }

    int words = TextMetrics.wordCount(text);
    if (limits.getMinWords() != null && words < limits.getMinWords()) {
      out.add(
          numeric(
                  location,
                  field,
                  RuleType.WORD_MINIMUM,
                  Severity.WARNING,
                  words,
                  limits.getMinWords())
              .message(field + " has " + words + " words, below minimum " + limits.getMinWords())
              .build());
    }
    if (limits.getMaxWords() != null && words > limits.getMaxWords()) {
      out.add(
          numeric(
                  location,
                  field,
                  RuleType.WORD_MAXIMUM,
                  Severity.ERROR,
                  words,
                  limits.getMaxWords())
              .message(field + " has " + words + " words, above maximum " + limits.getMaxWords())
              .build());
    }

    for (MarkerRequirement marker : limits.getMarkers()) {
      int found = TextMetrics.occurrences(text, marker.getToken());
      if (found < marker.getMinCount()) {
        out.add(
            numeric(
                    location,
                    field,
                    RuleType.MARKER_MINIMUM,
                    marker.getSeverity(),
                    found,
                    marker.getMinCount())
                .message(
                    field
                        + " has "
                        + found
                        + " "
                        + marker.getToken()
                        + " marker(s) (min "
                        + marker.getMinCount()
                        + ")")
                .build());
      }
    }
  }

  private Violation.ViolationBuilder numeric(
      String location, String field, RuleType rule, Severity severity, int measured, int limit) {
    return Violation.builder()
        .location(location)
        .field(field)
        .rule(rule)
        .severity(severity)
        .measured(measured)
        .limit(limit);
  }
}
