package com.flamingo.ai.coursegate.api.dto.request;

import com.flamingo.ai.coursegate.service.pipeline.SectionWorkload;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one section of a run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionRequest {

  @NotBlank(message = "Section name is required")
  private String section;

  @Builder.Default private List<@Valid ItemRequest> items = new ArrayList<>();

  @Builder.Default private List<@Valid ContentUnitRequest> units = new ArrayList<>();

  public SectionWorkload toWorkload() {
    return new SectionWorkload(
        section,
        items == null ? List.of() : items.stream().map(ItemRequest::toItem).toList(),
        units == null
            ? List.of()
            : units.stream().map(ContentUnitRequest::toContentUnit).toList());
  }
}
