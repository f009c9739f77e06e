package com.flamingo.ai.coursegate.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for classifying a batch of items. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassifyRequest {

  @NotEmpty(message = "At least one item is required")
  private List<@Valid ItemRequest> items;
}
