package com.flamingo.ai.coursegate.domain.state;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Partial update applied by {@code StateStore.write}. Scalars overwrite when set, sections merge
 * by key, errors and checkpoint references append.
 */
@Getter
@Builder
public class StateUpdate {

  private final String currentStep;
  private final String currentSection;
  private final PipelineStatus status;

  @Singular private final Map<String, SectionUpdate> sections;

  @Singular private final List<ErrorEntry> errors;

  @Singular private final List<CheckpointRef> checkpoints;
}
