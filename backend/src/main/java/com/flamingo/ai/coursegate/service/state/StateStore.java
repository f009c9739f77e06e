package com.flamingo.ai.coursegate.service.state;

import com.flamingo.ai.coursegate.domain.state.CheckpointRef;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.domain.state.StateUpdate;
import java.util.List;

/**
 * The single writer of pipeline state. All mutations of a run are serialized; every successful
 * write is persisted before it returns.
 */
public interface StateStore {

  /**
   * Returns the current state of a run, or an unpersisted empty template when the run was never
   * written.
   *
   * @throws com.flamingo.ai.coursegate.exception.StateCorruptedException if the stored record is
   *     unparseable or schema-invalid
   */
  PipelineState read(String runId);

  /**
   * Applies a partial update. Scalars overwrite, sections merge by key, errors and checkpoint
   * references append; the version and last-modified time always advance.
   *
   * @throws com.flamingo.ai.coursegate.exception.StateTransitionException if a status would move
   *     backwards
   */
  PipelineState write(String runId, StateUpdate update);

  StateValidationResult validate(String runId);

  /** Re-derives section status and last step from step statuses, then revalidates. */
  StateValidationResult repair(String runId);

  /** Stores an immutable snapshot of the current state under a name unique within the run. */
  CheckpointRef checkpoint(String runId, String name);

  /**
   * Replaces the live state with a validated checkpoint snapshot, marked {@code RECOVERED}. The
   * checkpoint registry of the live state is kept.
   */
  PipelineState recover(String runId, String name);

  List<CheckpointRef> listCheckpoints(String runId);

  PipelineProgress progress(String runId);
}
