package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Category;
import java.util.List;

/** Coarse subject-matter match against each category's routing keywords. */
public class RoutingTableRule extends KeywordListRule {

  @Override
  public String id() {
    return "routing-table";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.PRIMARY;
  }

  @Override
  protected List<String> keywords(Category category) {
    return category.routingKeywords();
  }
}
