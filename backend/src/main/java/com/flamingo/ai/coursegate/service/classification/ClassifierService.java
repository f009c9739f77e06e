package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.domain.model.Assignment;
import com.flamingo.ai.coursegate.domain.model.CategoryCatalog;
import com.flamingo.ai.coursegate.domain.model.Item;
import java.util.List;

/** Service assigning items to exactly one category through the ordered rule cascade. */
public interface ClassifierService {

  /**
   * Classifies a single item.
   *
   * @param item the item
   * @param context the category catalog plus batch-level data such as term dependencies
   * @return the assignment; never {@code null}
   */
  Assignment classify(Item item, ClassificationContext context);

  /** Classifies a whole batch against the configured catalog. */
  ClassificationResult classifyBatch(List<Item> items);

  /**
   * Classifies a whole batch. Either every item receives exactly one assignment or the call
   * fails; partial results are never returned.
   *
   * @throws IllegalArgumentException if two items share an id
   * @throws com.flamingo.ai.coursegate.exception.ClassificationException if a rule faults twice
   */
  ClassificationResult classifyBatch(List<Item> items, CategoryCatalog catalog);
}
