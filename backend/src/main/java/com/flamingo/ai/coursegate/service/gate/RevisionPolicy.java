package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.service.gate.RevisionDecision.Action;
import com.flamingo.ai.coursegate.service.gate.RevisionDecision.Reason;
import com.flamingo.ai.coursegate.service.report.Report;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a failed section goes back to generation or to a human. A section is retried
 * only while attempts remain and its score keeps improving.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevisionPolicy {

  private final PipelineConfig pipelineConfig;

  /**
   * @param result the latest gate result
   * @param previousScores weighted totals of earlier evaluations of the same section, oldest first
   * @param report the report built from the latest findings
   */
  public RevisionDecision decide(GateResult result, List<Double> previousScores, Report report) {
    int attempt = previousScores.size() + 1;
    if (!result.status().isBlocking()) {
      return new RevisionDecision(Action.ACCEPT, Reason.PASSED, attempt, List.of());
    }

    int maxIterations = pipelineConfig.getGate().getMaxRevisionIterations();
    if (attempt >= maxIterations) {
      log.warn("Escalating after {} attempt(s): iteration limit reached", attempt);
      return new RevisionDecision(Action.ESCALATE, Reason.MAX_ITERATIONS, attempt, List.of());
    }
    if (!previousScores.isEmpty()
        && result.weightedTotal() <= previousScores.get(previousScores.size() - 1)) {
      log.warn(
          "Escalating after {} attempt(s): score {} did not improve on {}",
          attempt,
          result.weightedTotal(),
          previousScores.get(previousScores.size() - 1));
      return new RevisionDecision(Action.ESCALATE, Reason.NO_IMPROVEMENT, attempt, List.of());
    }
    return new RevisionDecision(
        Action.RETRY, Reason.FAILED_RETRYABLE, attempt, report.actionItems());
  }
}
