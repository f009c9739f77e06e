package com.flamingo.ai.coursegate.service.validation;

import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;
import java.util.Map;

/** Aggregated outcome of validating a set of content units. */
public record ValidationResult(
    int unitsChecked,
    int unitsWithErrors,
    List<Violation> violations,
    Map<String, Long> countsByField,
    Map<RuleType, Long> countsByRule) {

  public long errorCount() {
    return violations.stream().filter(Violation::isError).count();
  }

  public long warningCount() {
    return violations.size() - errorCount();
  }

  public boolean hasErrors() {
    return errorCount() > 0;
  }
}
