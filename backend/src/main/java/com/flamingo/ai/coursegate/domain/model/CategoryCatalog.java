package com.flamingo.ai.coursegate.domain.model;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Ordered, immutable set of categories. Catalog order breaks every tie in classification. */
public final class CategoryCatalog {

  private final List<Category> categories;
  private final Map<String, Integer> positions;

  public CategoryCatalog(List<Category> categories) {
    this.categories = List.copyOf(categories);
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < this.categories.size(); i++) {
      Category category = this.categories.get(i);
      if (index.putIfAbsent(category.id(), i) != null) {
        throw new IllegalArgumentException("Duplicate category id: " + category.id());
      }
    }
    this.positions = Collections.unmodifiableMap(index);
  }

  public static CategoryCatalog from(PipelineConfig config) {
    return new CategoryCatalog(
        config.getCategories().stream()
            .map(
                def ->
                    new Category(
                        def.getId(),
                        def.getLabel(),
                        def.getMinimumPopulation(),
                        def.getRoutingKeywords(),
                        def.getFocusKeywords(),
                        def.getFoundationKeywords()))
            .toList());
  }

  public List<Category> categories() {
    return categories;
  }

  public List<String> ids() {
    return categories.stream().map(Category::id).toList();
  }

  public Optional<Category> find(String id) {
    Integer position = positions.get(id);
    return position == null ? Optional.empty() : Optional.of(categories.get(position));
  }

  public Category get(String id) {
    return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + id));
  }

  /** Catalog position of the category, used as a stable ordering key. */
  public int positionOf(String id) {
    Integer position = positions.get(id);
    if (position == null) {
      throw new IllegalArgumentException("Unknown category: " + id);
    }
    return position;
  }

  public boolean contains(String id) {
    return positions.containsKey(id);
  }

  public int size() {
    return categories.size();
  }
}
