package com.flamingo.ai.coursegate.service.pipeline;

import java.util.List;

/**
 * Runs sections through classification, validation, quota, gate and report on the section worker
 * pool, recording every step in the state store.
 */
public interface SectionPipelineService {

  /**
   * Runs the given sections and waits for them. Completed sections are skipped; sections left in
   * progress by an interrupted run are recomputed from scratch.
   *
   * @throws com.flamingo.ai.coursegate.exception.RunInProgressException if the run is already
   *     executing
   */
  RunSummary run(String runId, List<SectionWorkload> workloads);

  /** Asks a running run to stop; sections not yet started are left untouched. */
  boolean requestStop(String runId);

  boolean isRunning(String runId);
}
