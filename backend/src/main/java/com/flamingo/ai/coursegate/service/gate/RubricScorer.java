package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Deductive rubric: every configured dimension starts at 100 and loses the penalty of each
 * violation whose rule it owns, never dropping below 0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RubricScorer {

  private static final double FULL_SCORE = 100.0;

  private final PipelineConfig pipelineConfig;

  public List<ScoreCategory> toScoreCategories(List<Violation> violations) {
    PipelineConfig.Gate gate = pipelineConfig.getGate();
    List<ScoreCategory> categories = new ArrayList<>();
    for (Map.Entry<String, PipelineConfig.Dimension> entry : gate.getDimensions().entrySet()) {
      PipelineConfig.Dimension dimension = entry.getValue();
      List<Violation> owned =
          violations.stream().filter(v -> dimension.getRules().contains(v.rule())).toList();
      double score = FULL_SCORE;
      for (Violation violation : owned) {
        score -= penalty(violation.rule(), gate);
      }
      categories.add(
          new ScoreCategory(entry.getKey(), Math.max(0.0, score), dimension.getWeight(), owned));
    }

    long unscored =
        violations.stream()
            .filter(v -> categories.stream().noneMatch(c -> c.violations().contains(v)))
            .count();
    if (unscored > 0) {
      log.debug("{} violation(s) belong to no scored dimension", unscored);
    }
    return categories;
  }

  int penalty(RuleType rule, PipelineConfig.Gate gate) {
    return gate.getPenalties().getOrDefault(rule, gate.getDefaultPenalty());
  }
}
