package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Category;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import com.flamingo.ai.coursegate.service.classification.KeywordMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Forced final choice: the contender whose keywords are mentioned earliest in the item, read as
 * the single fact the item would be tested on. Ties and items with no mention go to the first
 * contender in catalog order.
 */
public class MostTestableFactRule implements ClassificationRule {

  @Override
  public String id() {
    return "most-testable-fact";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.TERTIARY;
  }

  @Override
  public boolean isForcing() {
    return true;
  }

  @Override
  public RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders) {
    if (contenders.isEmpty()) {
      throw new IllegalArgumentException("No contenders left for item " + item.id());
    }
    String chosen = contenders.get(0);
    int earliest = Integer.MAX_VALUE;
    for (String id : contenders) {
      int index = KeywordMatcher.firstIndex(item.text(), allKeywords(context.catalog().get(id)));
      if (index >= 0 && index < earliest) {
        earliest = index;
        chosen = id;
      }
    }
    return RuleOutcome.decisive(chosen);
  }

  private List<String> allKeywords(Category category) {
    List<String> keywords = new ArrayList<>(category.routingKeywords());
    category.focusKeywords().values().forEach(keywords::addAll);
    keywords.addAll(category.foundationKeywords());
    return keywords;
  }
}
