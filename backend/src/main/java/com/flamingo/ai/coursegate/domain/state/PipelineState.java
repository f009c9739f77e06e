package com.flamingo.ai.coursegate.domain.state;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
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

/**
 * Complete persisted progress record of one pipeline run.
 *
 * <p>Instances handed out by the state store are copies; mutating them has no effect on the
 * stored record.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineState {

  private String runId;
  private String currentStep;
  private String currentSection;

  @Builder.Default private PipelineStatus status = PipelineStatus.PENDING;

  /** Section states keyed by section name, in insertion order. */
  @Builder.Default private Map<String, SectionState> sections = new LinkedHashMap<>();

  @Builder.Default private List<ErrorEntry> errors = new ArrayList<>();

  @Builder.Default private List<CheckpointRef> checkpoints = new ArrayList<>();

  private Instant createdAt;
  private Instant lastModified;

  /** Increments on every successful write. Zero means never persisted. */
  private long version;

  /** Name of the checkpoint this state was last recovered from. */
  private String recoveredFrom;

  /** Template returned for a run that has never been written. */
  public static PipelineState empty(String runId) {
    Instant now = Instant.now();
    return PipelineState.builder().runId(runId).createdAt(now).lastModified(now).build();
  }

  /** Deep copy; sections are copied individually, log entries are immutable records. */
  public PipelineState copy() {
    Map<String, SectionState> sectionCopies = null;
    if (sections != null) {
      sectionCopies = new LinkedHashMap<>();
      for (Map.Entry<String, SectionState> entry : sections.entrySet()) {
        sectionCopies.put(
            entry.getKey(), entry.getValue() == null ? null : entry.getValue().copy());
      }
    }
    return PipelineState.builder()
        .runId(runId)
        .currentStep(currentStep)
        .currentSection(currentSection)
        .status(status)
        .sections(sectionCopies)
        .errors(errors == null ? null : new ArrayList<>(errors))
        .checkpoints(checkpoints == null ? null : new ArrayList<>(checkpoints))
        .createdAt(createdAt)
        .lastModified(lastModified)
        .version(version)
        .recoveredFrom(recoveredFrom)
        .build();
  }
}
