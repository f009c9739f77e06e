package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.enums.Priority;
import java.time.Instant;
import java.util.List;

/** Prioritised findings and the action items derived from them. */
public record Report(
    Priority overallSeverity,
    boolean requiresImmediateAction,
    List<Finding> findings,
    List<ActionItem> actionItems,
    Instant generatedAt) {

  public long count(Priority priority) {
    return findings.stream().filter(f -> f.priority() == priority).count();
  }

  public boolean isClean() {
    return findings.isEmpty();
  }
}
