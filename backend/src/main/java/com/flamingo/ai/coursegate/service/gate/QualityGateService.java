package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;

/** Weighted multi-dimension scorer deciding PASS, WARN or FAIL. */
public interface QualityGateService {

  /**
   * Scores already-computed dimensions.
   *
   * @throws IllegalArgumentException if the weights do not sum to 1.0 or a score is out of range
   */
  GateResult score(List<ScoreCategory> categories);

  /** Turns findings into rubric dimensions and scores them. */
  GateResult evaluate(List<Violation> violations);
}
