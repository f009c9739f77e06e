package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import java.util.List;
import java.util.Optional;

/**
 * A hard override that forces a gate to FAIL regardless of the weighted total. Conditions are
 * checked before the weighted total is trusted.
 */
public interface AutoFailCondition {

  /** Name reported in the gate result when the condition triggers. */
  String id();

  /**
   * @return a reason naming this condition and what triggered it, or empty when it holds
   */
  Optional<String> check(List<ScoreCategory> categories, PipelineConfig.Gate gate);
}
