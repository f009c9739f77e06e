package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.Verdict;
import com.flamingo.ai.coursegate.domain.model.Violation;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the QualityGateService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityGateServiceImpl implements QualityGateService {

  private static final double WEIGHT_TOLERANCE = 1e-6;

  /** Absorbs floating-point drift when a total lands exactly on a threshold. */
  private static final double SCORE_EPSILON = 1e-9;

  private final PipelineConfig pipelineConfig;
  private final RubricScorer rubricScorer;
  private final List<AutoFailCondition> autoFailConditions;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "gate.evaluate", description = "Time to evaluate a quality gate")
  public GateResult evaluate(List<Violation> violations) {
    return score(rubricScorer.toScoreCategories(violations));
  }

  @Override
  public GateResult score(List<ScoreCategory> categories) {
    validate(categories);
    PipelineConfig.Gate gate = pipelineConfig.getGate();

    // Automatic-fail conditions run before the weighted total is trusted
    List<String> autoFailReasons = new ArrayList<>();
    for (AutoFailCondition condition : autoFailConditions) {
      condition
          .check(categories, gate)
          .ifPresent(
              reason -> {
                autoFailReasons.add(reason);
                meterRegistry.counter("gate.auto_fail", "condition", condition.id()).increment();
              });
    }

    double total = 0.0;
    List<DimensionScore> dimensions = new ArrayList<>();
    for (ScoreCategory category : categories) {
      double contribution = category.rawScore() * category.weight();
      total += contribution;
      dimensions.add(
          new DimensionScore(
              category.name(),
              category.rawScore(),
              category.weight(),
              round(contribution),
              dimensionVerdict(category.rawScore(), gate),
              category.violations().size()));
    }

    Verdict status;
    if (!autoFailReasons.isEmpty()) {
      status = Verdict.FAIL;
      log.info("Gate forced to FAIL (weighted total {}): {}", round(total), autoFailReasons);
    } else if (total + SCORE_EPSILON >= gate.getPassThreshold()) {
      status = Verdict.PASS;
    } else if (total + SCORE_EPSILON >= gate.getWarnThreshold()) {
      status = Verdict.WARN;
    } else {
      status = Verdict.FAIL;
    }

    meterRegistry.counter("gate.evaluations", "status", status.name()).increment();
    log.debug("Gate result {} with weighted total {}", status, round(total));
    return new GateResult(round(total), status, autoFailReasons, dimensions);
  }

  private void validate(List<ScoreCategory> categories) {
    if (categories == null || categories.isEmpty()) {
      throw new IllegalArgumentException("At least one score category is required");
    }
    double weights = 0.0;
    for (ScoreCategory category : categories) {
      if (category.rawScore() < 0.0 || category.rawScore() > 100.0) {
        throw new IllegalArgumentException(
            "Score of " + category.name() + " out of range: " + category.rawScore());
      }
      if (category.weight() < 0.0) {
        throw new IllegalArgumentException("Negative weight for " + category.name());
      }
      weights += category.weight();
    }
    if (Math.abs(weights - 1.0) > WEIGHT_TOLERANCE) {
      throw new IllegalArgumentException("Gate weights must sum to 1.0 but sum to " + weights);
    }
  }

  private Verdict dimensionVerdict(double score, PipelineConfig.Gate gate) {
    if (score >= gate.getDimensionPassScore()) {
      return Verdict.PASS;
    }
    return score >= gate.getDimensionWarnScore() ? Verdict.WARN : Verdict.FAIL;
  }

  private static double round(double value) {
    return Math.round(value * 100.0) / 100.0;
  }
}
