package com.flamingo.ai.coursegate.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for running sections of a run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSectionsRequest {

  @NotEmpty(message = "At least one section is required")
  private List<@Valid SectionRequest> sections;
}
