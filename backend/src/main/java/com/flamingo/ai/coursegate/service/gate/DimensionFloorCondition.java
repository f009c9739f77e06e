package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import java.util.List;
import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Fails the gate when a dimension scores below its configured individual floor. */
@Component
@Order(2)
public class DimensionFloorCondition implements AutoFailCondition {

  @Override
  public String id() {
    return "dimension-floor";
  }

  @Override
  public Optional<String> check(List<ScoreCategory> categories, PipelineConfig.Gate gate) {
    for (ScoreCategory category : categories) {
      PipelineConfig.Dimension dimension = gate.getDimensions().get(category.name());
      if (dimension != null
          && dimension.getFloor() != null
          && category.rawScore() < dimension.getFloor()) {
        return Optional.of(
            String.format(
                "%s: %s scored %.1f (floor %.1f)",
                id(), category.name(), category.rawScore(), dimension.getFloor()));
      }
    }
    return Optional.empty();
  }
}
