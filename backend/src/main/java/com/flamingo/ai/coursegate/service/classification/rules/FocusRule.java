package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Category;
import java.util.List;

/**
 * Narrower heuristic over one named focus list (technique, period, population). Categories that
 * declare no keywords for the focus never match.
 */
public class FocusRule extends KeywordListRule {

  private final String focus;

  public FocusRule(String focus) {
    this.focus = focus;
  }

  @Override
  public String id() {
    return focus + "-focus";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.SECONDARY;
  }

  @Override
  protected List<String> keywords(Category category) {
    return category.focus(focus);
  }
}
