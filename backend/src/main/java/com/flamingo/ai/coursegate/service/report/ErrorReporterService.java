package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;

/** Turns findings into a prioritised report of deduplicated action items. */
public interface ErrorReporterService {

  /**
   * Builds a report. Both lists are reported; each finding keeps its own severity.
   *
   * @param violations blocking findings
   * @param warnings advisory findings
   */
  Report report(List<Violation> violations, List<Violation> warnings);
}
