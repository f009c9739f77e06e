package com.flamingo.ai.coursegate.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.service.classification.rules.BestFoundationRule;
import com.flamingo.ai.coursegate.service.classification.rules.ExplicitTagRule;
import com.flamingo.ai.coursegate.service.classification.rules.MostTestableFactRule;
import com.flamingo.ai.coursegate.service.classification.rules.RoutingTableRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClassificationRuleChainTest {

  @Test
  @DisplayName("standard chain should run primary, secondary then tertiary rules")
  void standardChainShouldFollowDeclaredOrder() {
    // When
    ClassificationRuleChain chain =
        ClassificationRuleChain.standard(PipelineConfigFixtures.standard().getClassification());

    // Then
    assertThat(chain.ruleIds())
        .containsExactly(
            "explicit-tag",
            "routing-table",
            "technique-focus",
            "period-focus",
            "population-focus",
            "best-foundation",
            "multi-category-dominance",
            "most-testable-fact");
  }

  @Test
  @DisplayName("should reject a rule declared after a later tier")
  void shouldRejectTierRegression() {
    assertThatThrownBy(
            () ->
                new ClassificationRuleChain(
                    List.of(
                        new BestFoundationRule(),
                        new RoutingTableRule(),
                        new MostTestableFactRule())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("routing-table");
  }

  @Test
  @DisplayName("should reject a chain that can end undecided")
  void shouldRejectChainWithoutForcingRule() {
    assertThatThrownBy(
            () ->
                new ClassificationRuleChain(
                    List.of(new ExplicitTagRule(), new RoutingTableRule())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Last rule");
  }
}
