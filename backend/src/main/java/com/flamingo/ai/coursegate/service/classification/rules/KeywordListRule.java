package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.model.Category;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import com.flamingo.ai.coursegate.service.classification.KeywordMatcher;
import java.util.List;

/**
 * Base for rules that match the item against one keyword list per category. Decisive when exactly
 * one contender matches, contested when several do.
 */
public abstract class KeywordListRule implements ClassificationRule {

  /** The keyword list this rule reads from a category. */
  protected abstract List<String> keywords(Category category);

  @Override
  public RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders) {
    List<String> matched =
        contenders.stream()
            .filter(id -> KeywordMatcher.hits(item.text(), keywords(context.catalog().get(id))) > 0)
            .toList();
    return RuleOutcome.contested(matched);
  }
}
