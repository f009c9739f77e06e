package com.flamingo.ai.coursegate.service.state;

import com.flamingo.ai.coursegate.domain.enums.StateHealth;
import java.util.List;

/** Health of a stored state with the issues that made it less than valid. */
public record StateValidationResult(String runId, StateHealth health, List<String> issues) {

  public StateValidationResult {
    issues = List.copyOf(issues);
  }

  public static StateValidationResult of(String runId, List<String> issues) {
    return new StateValidationResult(
        runId, issues.isEmpty() ? StateHealth.VALID : StateHealth.INVALID, issues);
  }

  public static StateValidationResult corrupted(String runId, String reason) {
    return new StateValidationResult(runId, StateHealth.CORRUPTED, List.of(reason));
  }

  public boolean isValid() {
    return health == StateHealth.VALID;
  }
}
