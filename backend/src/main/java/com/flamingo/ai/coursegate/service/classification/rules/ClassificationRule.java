package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import java.util.List;

/**
 * One pure predicate of the classification cascade. Implementations hold no mutable state and
 * never refer to a concrete category; everything category-specific comes from the catalog.
 */
public interface ClassificationRule {

  /** Stable identifier recorded on the assignment this rule decides. */
  String id();

  RuleTier tier();

  /**
   * Evaluates the item.
   *
   * @param item the item to classify
   * @param context catalog, settings and batch-level data
   * @param contenders category ids still in play, in catalog order; the whole catalog for primary
   *     and secondary rules
   * @return the rule's conclusion, restricted to {@code contenders}
   */
  RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders);

  /** Whether the rule always returns a decisive outcome for a non-empty contender list. */
  default boolean isForcing() {
    return false;
  }
}
