package com.flamingo.ai.coursegate.service.classification;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.coursegate.domain.model.Item;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DependencyMapperTest {

  private static final List<String> CUES =
      List.of("is defined as", "refers to", "means", "is a", "is an");

  private final DependencyMapper dependencyMapper = new DependencyMapper();

  @Test
  @DisplayName("should link a defining item to every item using its term")
  void shouldLinkDefinerToUsers() {
    // Given
    List<Item> items =
        List.of(
            Item.of(1, "Cardiac output is defined as stroke volume times heart rate."),
            Item.of(2, "Low cardiac output causes fatigue"),
            Item.of(3, "Monitor urine"),
            Item.of(4, "Cardiac output falls in shock"));

    // When
    Map<Integer, Set<Integer>> dependents = dependencyMapper.mapDependencies(items, CUES);

    // Then
    assertThat(dependents).containsOnlyKeys(1);
    assertThat(dependents.get(1)).containsExactly(2, 4);
  }

  @Test
  @DisplayName("should prefer the longest cue and strip leading articles and tags")
  void shouldStripArticlesAndTags() {
    // Given
    List<Item> items =
        List.of(
            Item.of(1, "[cardio] The afterload is defined as resistance to ejection"),
            Item.of(2, "Vasodilators reduce afterload"));

    // When
    Map<Integer, Set<Integer>> dependents = dependencyMapper.mapDependencies(items, CUES);

    // Then
    assertThat(dependents).containsEntry(1, Set.of(2));
  }

  @Test
  @DisplayName("should ignore subjects too long to be a term")
  void shouldIgnoreLongSubjects() {
    // Given
    List<Item> items =
        List.of(
            Item.of(1, "Checking the patient every single hour is a good habit"),
            Item.of(2, "Checking the patient every single hour"));

    // When / Then
    assertThat(dependencyMapper.mapDependencies(items, CUES)).isEmpty();
  }

  @Test
  @DisplayName("should not treat a term used only by its definer as a dependency")
  void shouldIgnoreSelfReference() {
    // Given
    List<Item> items = List.of(Item.of(1, "Preload refers to stretch; preload rises with volume"));

    // When / Then
    assertThat(dependencyMapper.mapDependencies(items, CUES)).isEmpty();
  }
}
