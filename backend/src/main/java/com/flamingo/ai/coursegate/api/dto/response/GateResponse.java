package com.flamingo.ai.coursegate.api.dto.response;

import com.flamingo.ai.coursegate.service.gate.GateResult;
import com.flamingo.ai.coursegate.service.report.Report;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO pairing a gate result with the report of the same findings. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateResponse {

  private GateResult gate;
  private Report report;
}
