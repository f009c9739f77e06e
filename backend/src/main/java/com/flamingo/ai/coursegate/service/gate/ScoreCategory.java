package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.domain.model.Violation;
import jakarta.validation.Valid;
import java.util.List;

/**
 * One weighted dimension of a gate evaluation.
 *
 * @param rawScore 0 to 100
 * @param weight fraction of the total; weights of one evaluation sum to 1.0
 * @param violations findings that were deducted from this dimension
 */
public record ScoreCategory(
    String name, double rawScore, double weight, List<@Valid Violation> violations) {

  public ScoreCategory {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }
}
