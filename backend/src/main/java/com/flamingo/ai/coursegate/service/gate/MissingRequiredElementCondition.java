package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fails the gate when any required field is missing or blank. */
@Component
@Order(1)
public class MissingRequiredElementCondition implements AutoFailCondition {

  @Override
  public String id() {
    return "missing-required-element";
  }

  @Override
  public Optional<String> check(List<ScoreCategory> categories, PipelineConfig.Gate gate) {
    return categories.stream()
        .flatMap(c -> c.violations().stream())
        .filter(v -> v.rule() == RuleType.REQUIRED_FIELD && v.isError())
        .map(Violation::location)
        .findFirst()
        .map(location -> id() + ": " + location);
  }
}
