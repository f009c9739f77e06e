package com.flamingo.ai.coursegate.domain.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.StepStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Progress of one section through the pipeline steps. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SectionState {

  @Builder.Default private PipelineStatus status = PipelineStatus.PENDING;

  /** Last step that reached COMPLETED, or {@code null} before any did. */
  private String lastStep;

  @Builder.Default private Map<String, StepStatus> steps = new LinkedHashMap<>();

  /** Weighted gate totals, one per evaluation, oldest first. */
  @Builder.Default private List<Double> gateScores = new ArrayList<>();

  private Instant updatedAt;

  public SectionState copy() {
    return SectionState.builder()
        .status(status)
        .lastStep(lastStep)
        .steps(steps == null ? null : new LinkedHashMap<>(steps))
        .gateScores(gateScores == null ? null : new ArrayList<>(gateScores))
        .updatedAt(updatedAt)
        .build();
  }

  @JsonIgnore
  public boolean isCompleted() {
    return status == PipelineStatus.COMPLETED;
  }

  public StepStatus stepStatus(String step) {
    return steps == null ? StepStatus.PENDING : steps.getOrDefault(step, StepStatus.PENDING);
  }
}
