package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.service.classification.rules.BestFoundationRule;
import com.flamingo.ai.coursegate.service.classification.rules.ClassificationRule;
import com.flamingo.ai.coursegate.service.classification.rules.DominanceRule;
import com.flamingo.ai.coursegate.service.classification.rules.ExplicitTagRule;
import com.flamingo.ai.coursegate.service.classification.rules.FocusRule;
import com.flamingo.ai.coursegate.service.classification.rules.MostTestableFactRule;
import com.flamingo.ai.coursegate.service.classification.rules.RoutingTableRule;
import java.util.ArrayList;
import java.util.List;

/**
 * The ordered rule list. Declared order is the only priority between rules: tiers must not go
 * backwards and the last rule must be forcing so every evaluation terminates with one category.
 */
public final class ClassificationRuleChain {

  private final List<ClassificationRule> rules;

  public ClassificationRuleChain(List<ClassificationRule> rules) {
    if (rules.isEmpty()) {
      throw new IllegalArgumentException("Rule chain must not be empty");
    }
    for (int i = 1; i < rules.size(); i++) {
      if (rules.get(i).tier().compareTo(rules.get(i - 1).tier()) < 0) {
        throw new IllegalArgumentException(
            "Rule " + rules.get(i).id() + " is declared after a rule of a later tier");
      }
    }
    if (!rules.get(rules.size() - 1).isForcing()) {
      throw new IllegalArgumentException("Last rule must always decide");
    }
    this.rules = List.copyOf(rules);
  }

  /** Primary, secondary from the configured focuses, then the three tie-breakers. */
  public static ClassificationRuleChain standard(PipelineConfig.Classification settings) {
    List<ClassificationRule> rules = new ArrayList<>();
    rules.add(new ExplicitTagRule());
    rules.add(new RoutingTableRule());
    settings.getSecondaryFocuses().forEach(focus -> rules.add(new FocusRule(focus)));
    rules.add(new BestFoundationRule());
    rules.add(new DominanceRule());
    rules.add(new MostTestableFactRule());
    return new ClassificationRuleChain(rules);
  }

  public List<ClassificationRule> rules() {
    return rules;
  }

  public List<String> ruleIds() {
    return rules.stream().map(ClassificationRule::id).toList();
  }
}
