package com.flamingo.ai.coursegate.api.dto.request;

import com.flamingo.ai.coursegate.domain.enums.UnitType;
import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one generated content unit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentUnitRequest {

  @NotBlank(message = "Unit id is required")
  private String id;

  private String categoryId;

  @NotNull(message = "Unit type is required")
  private UnitType type;

  @Builder.Default private Map<String, String> fields = new LinkedHashMap<>();

  public ContentUnit toContentUnit() {
    return new ContentUnit(id, categoryId, type, fields);
  }
}
