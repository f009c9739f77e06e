package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.CheckpointRequest;
import com.flamingo.ai.coursegate.domain.state.CheckpointRef;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.service.state.PipelineProgress;
import com.flamingo.ai.coursegate.service.state.StateStore;
import com.flamingo.ai.coursegate.service.state.StateValidationResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for pipeline state, checkpoints and recovery. */
@RestController
@RequestMapping("/api/runs/{runId}")
@RequiredArgsConstructor
public class RunStateController {

  private final StateStore stateStore;

  /** Gets the current state, or an empty template for an unknown run. */
  @GetMapping("/state")
  public ResponseEntity<PipelineState> getState(@PathVariable String runId) {
    return ResponseEntity.ok(stateStore.read(runId));
  }

  @GetMapping("/state/validation")
  public ResponseEntity<StateValidationResult> validateState(@PathVariable String runId) {
    return ResponseEntity.ok(stateStore.validate(runId));
  }

  @PostMapping("/state/repair")
  public ResponseEntity<StateValidationResult> repairState(@PathVariable String runId) {
    return ResponseEntity.ok(stateStore.repair(runId));
  }

  @GetMapping("/progress")
  public ResponseEntity<PipelineProgress> getProgress(@PathVariable String runId) {
    return ResponseEntity.ok(stateStore.progress(runId));
  }

  @GetMapping("/checkpoints")
  public ResponseEntity<List<CheckpointRef>> listCheckpoints(@PathVariable String runId) {
    return ResponseEntity.ok(stateStore.listCheckpoints(runId));
  }

  /** Creates a named checkpoint of the current state. */
  @PostMapping("/checkpoints")
  public ResponseEntity<CheckpointRef> createCheckpoint(
      @PathVariable String runId, @Valid @RequestBody CheckpointRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(stateStore.checkpoint(runId, request.getName()));
  }

  /** Replaces the live state with the named checkpoint. */
  @PostMapping("/checkpoints/{name}/recover")
  public ResponseEntity<PipelineState> recover(
      @PathVariable String runId, @PathVariable String name) {
    return ResponseEntity.ok(stateStore.recover(runId, name));
  }
}
