package com.flamingo.ai.coursegate.service.classification.rules;

import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Category;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.service.classification.ClassificationContext;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Decides items whose text starts with a bracketed category id or label, e.g. {@code [pharm]}. */
public class ExplicitTagRule implements ClassificationRule {

  private static final Pattern TAG = Pattern.compile("^\\s*\\[([^\\]]+)\\]");

  @Override
  public String id() {
    return "explicit-tag";
  }

  @Override
  public RuleTier tier() {
    return RuleTier.PRIMARY;
  }

  @Override
  public RuleOutcome evaluate(Item item, ClassificationContext context, List<String> contenders) {
    Matcher matcher = TAG.matcher(item.text());
    if (!matcher.find()) {
      return RuleOutcome.abstain();
    }
    String tag = matcher.group(1).strip();
    for (String id : contenders) {
      Category category = context.catalog().get(id);
      if (category.id().equalsIgnoreCase(tag)
          || (category.label() != null && category.label().equalsIgnoreCase(tag))) {
        return RuleOutcome.decisive(id);
      }
    }
    return RuleOutcome.abstain();
  }
}
