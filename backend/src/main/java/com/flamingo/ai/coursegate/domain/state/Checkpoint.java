package com.flamingo.ai.coursegate.domain.state;

import java.time.Instant;

/** Immutable named snapshot of a pipeline state. */
public record Checkpoint(String name, Instant createdAt, PipelineState snapshot) {

  /** Returns a copy so callers cannot alter the stored snapshot. */
  @Override
  public PipelineState snapshot() {
    return snapshot == null ? null : snapshot.copy();
  }

  public CheckpointRef toRef() {
    return new CheckpointRef(name, createdAt);
  }
}
