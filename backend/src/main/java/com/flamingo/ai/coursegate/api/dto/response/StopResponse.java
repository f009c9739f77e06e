package com.flamingo.ai.coursegate.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stop request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopResponse {

  private String runId;

  /** False when the run was not executing. */
  private boolean stopRequested;
}
