package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import com.flamingo.ai.coursegate.service.classification.KeywordMatcher;
import java.util.ArrayList;
import java.util.List;

/**
 * Prefers the contender the item best lays a foundation for, measured by foundation-keyword hits.
 * Contenders tied on the highest count stay contested.
 */
public class BestFoundationRule implements ClassificationRule {

  @Override
  public String id() {
    return "best-foundation";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.TERTIARY;
  }

  @Override
  public RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders) {
    int best = 0;
    List<String> leaders = new ArrayList<>();
    for (String id : contenders) {
      int hits =
          KeywordMatcher.hits(item.text(), context.catalog().get(id).foundationKeywords());
      if (hits == 0) {
        continue;
      }
      if (hits > best) {
        best = hits;
        leaders.clear();
      }
      if (hits == best) {
        leaders.add(id);
      }
    }
    return RuleOutcome.contested(leaders);
  }
}
