package com.flamingo.ai.coursegate.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.UnitType;
import com.flamingo.ai.coursegate.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursegate.exception.RunInProgressException;
import com.flamingo.ai.coursegate.service.pipeline.RunSummary;
import com.flamingo.ai.coursegate.service.pipeline.SectionOutcome;
import com.flamingo.ai.coursegate.service.pipeline.SectionPipelineService;
import com.flamingo.ai.coursegate.service.pipeline.SectionWorkload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineRunController Tests")
class PipelineRunControllerTest {

  private static final String BODY =
      """
      {"sections":[{"section":"cardiac",
        "items":[{"id":1,"text":"Assess heart sounds"}],
        "units":[{"id":"u1","type":"CONTENT","fields":{"header":"Heart","body":"Assess"}}]}]}
      """;

  private MockMvc mockMvc;
  private SimpleMeterRegistry meterRegistry;

  @Mock private SectionPipelineService sectionPipelineService;

  @Captor private ArgumentCaptor<List<SectionWorkload>> workloads;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new PipelineRunController(sectionPipelineService))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should run the submitted sections")
  void shouldRunSections() throws Exception {
    when(sectionPipelineService.run(eq("run-1"), anyList()))
        .thenReturn(
            new RunSummary(
                "run-1",
                PipelineStatus.COMPLETED,
                false,
                List.of(
                    SectionOutcome.builder()
                        .section("cardiac")
                        .status(PipelineStatus.COMPLETED)
                        .build())));

    mockMvc
        .perform(
            post("/api/runs/{runId}/sections", "run-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.sections[0].section").value("cardiac"));

    verify(sectionPipelineService).run(eq("run-1"), workloads.capture());
    SectionWorkload workload = workloads.getValue().get(0);
    assertThat(workload.section()).isEqualTo("cardiac");
    assertThat(workload.items())
        .singleElement()
        .satisfies(item -> assertThat(item.wordCount()).isEqualTo(3));
    assertThat(workload.units().get(0).type()).isEqualTo(UnitType.CONTENT);
  }

  @Test
  @DisplayName("Should answer 409 when the run is already executing")
  void shouldReturnConflict_whenRunInProgress() throws Exception {
    when(sectionPipelineService.run(eq("run-1"), anyList()))
        .thenThrow(new RunInProgressException("run-1"));

    mockMvc
        .perform(
            post("/api/runs/{runId}/sections", "run-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("RUN_001"));

    assertThat(meterRegistry.counter("api_errors_total", "error_type", "run_in_progress").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject a body that is not JSON")
  void shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(
            post("/api/runs/{runId}/sections", "run-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_002"));
  }

  @Test
  @DisplayName("Should report whether a stop was requested")
  void shouldRequestStop() throws Exception {
    when(sectionPipelineService.requestStop("run-1")).thenReturn(false);

    mockMvc
        .perform(post("/api/runs/{runId}/stop", "run-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.runId").value("run-1"))
        .andExpect(jsonPath("$.stopRequested").value(false));
  }
}
