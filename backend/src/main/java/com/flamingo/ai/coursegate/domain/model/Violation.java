package com.flamingo.ai.coursegate.domain.model;

import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * A single rule breach found in a content unit or collection.
 *
 * @param location where the breach was found, e.g. {@code slide-3/body:line 4}
 * @param measured the observed value, when the rule is numeric
 * @param limit the configured limit, when the rule is numeric
 * @param field the field the rule applies to, if any
 */
@Builder
public record Violation(
    String location,
    @NotNull(message = "Violation rule is required") RuleType rule,
    @NotNull(message = "Violation severity is required") Severity severity,
    String message,
    Integer measured,
    Integer limit,
    String field) {

  public boolean isError() {
    return severity == Severity.ERROR;
  }
}
