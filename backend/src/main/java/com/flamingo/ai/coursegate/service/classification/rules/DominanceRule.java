package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import com.flamingo.ai.coursegate.service.classification.KeywordMatcher;
import java.util.List;

/**
 * Decides for the contender whose routing hits dominate every other contender by the configured
 * ratio. Abstains otherwise.
 */
public class DominanceRule implements ClassificationRule {

  @Override
  public String id() {
    return "multi-category-dominance";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.TERTIARY;
  }

  @Override
  public RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders) {
    String leader = null;
    int top = 0;
    int runnerUp = 0;
    for (String id : contenders) {
      int hits = KeywordMatcher.hits(item.text(), context.catalog().get(id).routingKeywords());
      if (hits > top) {
        runnerUp = top;
        top = hits;
        leader = id;
      } else if (hits > runnerUp) {
        runnerUp = hits;
      }
    }
    if (leader == null) {
      return RuleOutcome.abstain();
    }
    double ratio = context.settings().getDominanceRatio();
    return top >= ratio * runnerUp && top > runnerUp
        ? RuleOutcome.decisive(leader)
        : RuleOutcome.abstain();
  }
}
