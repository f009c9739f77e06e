package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.config.PipelineConfig.SeverityRule;
import com.flamingo.ai.coursegate.domain.enums.FindingCategory;
import com.flamingo.ai.coursegate.domain.enums.Priority;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Priority lookup keyed by (category, rule, field). An exact match wins over a rule that applies
 * to any field; with no match the priority follows the original severity.
 */
@Component
@RequiredArgsConstructor
public class SeverityTable {

  private final PipelineConfig pipelineConfig;

  public Priority resolve(
      FindingCategory category, RuleType rule, String field, Severity severity) {
    return find(category, rule, field)
        .or(() -> find(category, rule, null))
        .orElseGet(() -> Priority.fromSeverity(severity));
  }

  private Optional<Priority> find(FindingCategory category, RuleType rule, String field) {
    return pipelineConfig.getReport().getSeverityRules().stream()
        .filter(r -> r.getCategory() == category && r.getRule() == rule)
        .filter(r -> Objects.equals(r.getField(), field))
        .map(SeverityRule::getPriority)
        .findFirst();
  }
}
