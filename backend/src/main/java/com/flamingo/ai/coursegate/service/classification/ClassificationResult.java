package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Assignment;
import java.util.List;
import java.util.Map;

/**
 * Assignments for a whole batch, in input order, with the distribution across categories.
 *
 * @param distribution assigned item count per category, in catalog order, including empty ones
 * @param decisionsByTier how many items each tier decided
 * @param shortfalls categories below their minimum population
 */
public record ClassificationResult(
    List<Assignment> assignments,
    Map<String, Integer> distribution,
    Map<RuleTier, Long> decisionsByTier,
    List<CategoryShortfall> shortfalls) {

  public boolean needsReview() {
    return !shortfalls.isEmpty();
  }
}
