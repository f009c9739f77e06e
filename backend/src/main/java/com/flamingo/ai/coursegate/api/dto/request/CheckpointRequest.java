package com.flamingo.ai.coursegate.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for creating a checkpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointRequest {

  @NotBlank(message = "Checkpoint name is required")
  @Pattern(
      regexp = "[A-Za-z0-9][A-Za-z0-9._-]{0,127}",
      message = "Checkpoint name may only contain letters, digits, '.', '_' and '-'")
  private String name;
}
