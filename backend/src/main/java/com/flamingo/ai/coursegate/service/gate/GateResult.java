package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.domain.enums.Verdict;
import java.util.List;

/**
 * Aggregated gate decision. The weighted total is reported even when an automatic-fail
 * condition forced the status.
 */
public record GateResult(
    double weightedTotal,
    Verdict status,
    List<String> autoFailReasons,
    List<DimensionScore> dimensions) {

  public GateResult {
    autoFailReasons = List.copyOf(autoFailReasons);
    dimensions = List.copyOf(dimensions);
  }

  public boolean isAutoFailed() {
    return !autoFailReasons.isEmpty();
  }
}
