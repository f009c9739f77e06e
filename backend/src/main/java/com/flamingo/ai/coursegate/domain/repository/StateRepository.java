package com.flamingo.ai.coursegate.domain.repository;

import com.flamingo.ai.coursegate.domain.state.Checkpoint;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for pipeline state. Implementations only move records in and out of storage;
 * merging, locking and consistency checks belong to the state store service.
 */
public interface StateRepository {

  /**
   * @return the stored state, or empty when the run was never written
   * @throws com.flamingo.ai.coursegate.exception.StateCorruptedException if the record is
   *     unparseable or schema-invalid
   */
  Optional<PipelineState> load(String runId);

  /** Replaces the stored state atomically. */
  void save(PipelineState state);

  Optional<Checkpoint> loadCheckpoint(String runId, String name);

  /** Stores a checkpoint record; an existing record of the same name is never overwritten. */
  void saveCheckpoint(String runId, Checkpoint checkpoint);

  boolean checkpointExists(String runId, String name);

  /** Checkpoint names found in storage, sorted. */
  List<String> listCheckpointNames(String runId);
}
