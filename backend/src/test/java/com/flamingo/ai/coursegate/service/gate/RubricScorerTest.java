package com.flamingo.ai.coursegate.service.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RubricScorerTest {

  private final RubricScorer rubricScorer = new RubricScorer(PipelineConfigFixtures.standard());

  private static Violation violation(RuleType rule) {
    return Violation.builder()
        .location("slide-1/body")
        .rule(rule)
        .severity(Severity.ERROR)
        .message(rule.name())
        .build();
  }

  @Test
  @DisplayName("should create one category per configured dimension in order")
  void shouldCreateCategoryPerDimension() {
    // When
    List<ScoreCategory> categories = rubricScorer.toScoreCategories(List.of());

    // Then
    assertThat(categories)
        .extracting(ScoreCategory::name)
        .containsExactly(
            "structure",
            "line_count",
            "character_count",
            "content_rules",
            "visual_quota",
            "category_balance");
    assertThat(categories).allSatisfy(c -> assertThat(c.rawScore()).isEqualTo(100.0));
    assertThat(categories.stream().mapToDouble(ScoreCategory::weight).sum())
        .isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("should deduct the configured penalty from the owning dimension")
  void shouldDeductConfiguredPenalty() {
    // When
    List<ScoreCategory> categories =
        rubricScorer.toScoreCategories(
            List.of(violation(RuleType.REQUIRED_FIELD), violation(RuleType.LINE_LIMIT)));

    // Then
    assertThat(categories.get(0).rawScore()).isEqualTo(85.0);
    assertThat(categories.get(0).violations()).hasSize(1);
    assertThat(categories.get(1).rawScore()).isEqualTo(95.0);
  }

  @Test
  @DisplayName("should fall back to the default penalty and never go below zero")
  void shouldUseDefaultPenaltyAndFloorAtZero() {
    // Given
    List<Violation> violations = Collections.nCopies(25, violation(RuleType.WORD_MAXIMUM));

    // When
    ScoreCategory contentRules = rubricScorer.toScoreCategories(violations).get(3);

    // Then
    assertThat(contentRules.name()).isEqualTo("content_rules");
    assertThat(contentRules.rawScore()).isZero();
  }
}
