package com.flamingo.ai.coursegate.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for validating content units. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidateRequest {

  @NotEmpty(message = "At least one unit is required")
  private List<@Valid ContentUnitRequest> units;
}
