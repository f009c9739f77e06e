package com.flamingo.ai.coursegate.service.pipeline;

import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import com.flamingo.ai.coursegate.domain.model.Item;
import java.util.List;

/** Input of one section: the items to classify and the generated units to check. */
public record SectionWorkload(String section, List<Item> items, List<ContentUnit> units) {

  public SectionWorkload {
    items = items == null ? List.of() : List.copyOf(items);
    units = units == null ? List.of() : List.copyOf(units);
  }
}
