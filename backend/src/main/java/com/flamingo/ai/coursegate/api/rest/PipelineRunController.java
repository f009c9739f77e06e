package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.RunSectionsRequest;
import com.flamingo.ai.coursegate.api.dto.request.SectionRequest;
import com.flamingo.ai.coursegate.api.dto.response.StopResponse;
import com.flamingo.ai.coursegate.service.pipeline.RunSummary;
import com.flamingo.ai.coursegate.service.pipeline.SectionPipelineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for running sections of a pipeline run. */
@RestController
@RequestMapping("/api/runs/{runId}")
@RequiredArgsConstructor
public class PipelineRunController {

  private final SectionPipelineService sectionPipelineService;

  /** Runs the sections and returns when every submitted section has finished or was skipped. */
  @PostMapping("/sections")
  public ResponseEntity<RunSummary> runSections(
      @PathVariable String runId, @Valid @RequestBody RunSectionsRequest request) {
    return ResponseEntity.ok(
        sectionPipelineService.run(
            runId, request.getSections().stream().map(SectionRequest::toWorkload).toList()));
  }

  /** Requests a stop between sections. */
  @PostMapping("/stop")
  public ResponseEntity<StopResponse> stop(@PathVariable String runId) {
    return ResponseEntity.ok(
        StopResponse.builder()
            .runId(runId)
            .stopRequested(sectionPipelineService.requestStop(runId))
            .build());
  }
}
