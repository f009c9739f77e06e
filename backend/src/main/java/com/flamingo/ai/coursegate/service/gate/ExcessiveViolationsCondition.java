package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fails the gate when one rule type is violated more often than its configured maximum. */
@Component
@Order(3)
public class ExcessiveViolationsCondition implements AutoFailCondition {

  @Override
  public String id() {
    return "excessive-violations";
  }

  @Override
  public Optional<String> check(List<ScoreCategory> categories, PipelineConfig.Gate gate) {
    Map<RuleType, Integer> counts = new EnumMap<>(RuleType.class);
    categories.stream()
        .flatMap(c -> c.violations().stream())
        .forEach(v -> counts.merge(v.rule(), 1, Integer::sum));

    for (Map.Entry<RuleType, Integer> limit : gate.getMaxViolations().entrySet()) {
      int count = counts.getOrDefault(limit.getKey(), 0);
      if (count > limit.getValue()) {
        return Optional.of(
            String.format(
                "%s: %d %s violation(s) (max %d)",
                id(), count, limit.getKey(), limit.getValue()));
      }
    }
    return Optional.empty();
  }
}
