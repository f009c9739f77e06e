package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.model.CategoryCatalog;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a rule may consult besides the item itself.
 *
 * @param dependents ids of the items that depend on a term each item defines, keyed by the
 *     defining item's id
 */
public record ClassificationContext(
    CategoryCatalog catalog,
    PipelineConfig.Classification settings,
    Map<Integer, Set<Integer>> dependents) {

  public ClassificationContext {
    dependents = dependents == null ? Map.of() : Map.copyOf(dependents);
  }

  public static ClassificationContext standalone(
      CategoryCatalog catalog, PipelineConfig.Classification settings) {
    return new ClassificationContext(catalog, settings, Map.of());
  }

  public List<String> allCategoryIds() {
    return catalog.ids();
  }

  public Set<Integer> dependentsOf(int itemId) {
    return dependents.getOrDefault(itemId, Set.of());
  }
}
