package com.flamingo.ai.coursegate.domain.model;

import com.flamingo.ai.coursegate.domain.enums.UnitType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A generated artifact submitted for validation, such as one slide. Produced by an external
 * generator; this service only inspects it.
 */
public record ContentUnit(String id, String categoryId, UnitType type, Map<String, String> fields) {

  public ContentUnit {
    fields =
        fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String field(String name) {
    return fields.get(name);
  }
}
