package com.flamingo.ai.coursegate.domain.state;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.StepStatus;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** Partial update of one section. Unset fields leave the stored value untouched. */
@Getter
@Builder
public class SectionUpdate {

  private final PipelineStatus status;
  private final String lastStep;

  /** Clears the last step and sets every recorded step back to PENDING before merging. */
  private final boolean resetProgress;

  /** Merged into the stored steps by key. */
  @Singular private final Map<String, StepStatus> steps;

  /** Appended to the stored gate scores. */
  @Singular private final List<Double> gateScores;
}
