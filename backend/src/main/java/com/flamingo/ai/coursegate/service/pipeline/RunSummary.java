package com.flamingo.ai.coursegate.service.pipeline;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import java.util.List;

/** Outcome of one invocation of the section runner. */
public record RunSummary(
    String runId, PipelineStatus status, boolean stopped, List<SectionOutcome> sections) {

  public RunSummary {
    sections = List.copyOf(sections);
  }
}
