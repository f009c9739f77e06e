package com.flamingo.ai.coursegate.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.coursegate.api.dto.request.CheckpointRequest;
import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.domain.enums.StateHealth;
import com.flamingo.ai.coursegate.domain.state.CheckpointRef;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.exception.CheckpointNotFoundException;
import com.flamingo.ai.coursegate.exception.DuplicateCheckpointException;
import com.flamingo.ai.coursegate.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursegate.exception.RecoveryException;
import com.flamingo.ai.coursegate.exception.StateCorruptedException;
import com.flamingo.ai.coursegate.service.state.StateStore;
import com.flamingo.ai.coursegate.service.state.StateValidationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunStateController Tests")
class RunStateControllerTest {

  private static final String RUN = "run-1";

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @Mock private StateStore stateStore;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(new RunStateController(stateStore))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Nested
  @DisplayName("State")
  class State {

    @Test
    @DisplayName("Should return the current state")
    void shouldReturnState() throws Exception {
      PipelineState state = PipelineState.empty(RUN);
      state.setStatus(PipelineStatus.IN_PROGRESS);
      state.setVersion(3);
      when(stateStore.read(RUN)).thenReturn(state);

      mockMvc
          .perform(get("/api/runs/{runId}/state", RUN))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.runId").value(RUN))
          .andExpect(jsonPath("$.status").value("IN_PROGRESS"))
          .andExpect(jsonPath("$.version").value(3));
    }

    @Test
    @DisplayName("Should answer 409 when the stored state is corrupted")
    void shouldReturnConflict_whenCorrupted() throws Exception {
      when(stateStore.read(RUN)).thenThrow(new StateCorruptedException(RUN, "bad json"));

      mockMvc
          .perform(get("/api/runs/{runId}/state", RUN))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.code").value("STATE_001"))
          .andExpect(jsonPath("$.path").value("/api/runs/run-1/state"))
          .andExpect(jsonPath("$.errorId").isNotEmpty());
    }

    @Test
    @DisplayName("Should report validation health as data")
    void shouldReportHealth() throws Exception {
      when(stateStore.validate(RUN))
          .thenReturn(StateValidationResult.corrupted(RUN, "unparseable"));

      mockMvc
          .perform(get("/api/runs/{runId}/state/validation", RUN))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.health").value(StateHealth.CORRUPTED.name()))
          .andExpect(jsonPath("$.issues[0]").value("unparseable"));
    }
  }

  @Nested
  @DisplayName("Checkpoints")
  class Checkpoints {

    @Test
    @DisplayName("Should create a checkpoint with 201")
    void shouldCreateCheckpoint() throws Exception {
      when(stateStore.checkpoint(RUN, "before-gate"))
          .thenReturn(new CheckpointRef("before-gate", Instant.parse("2026-01-05T10:15:30Z")));

      mockMvc
          .perform(
              post("/api/runs/{runId}/checkpoints", RUN)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content(
                      objectMapper.writeValueAsString(
                          CheckpointRequest.builder().name("before-gate").build())))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.name").value("before-gate"));
    }

    @Test
    @DisplayName("Should reject a checkpoint name that is not path-safe")
    void shouldRejectUnsafeName() throws Exception {
      mockMvc
          .perform(
              post("/api/runs/{runId}/checkpoints", RUN)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\":\"../escape\"}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verify(stateStore, never()).checkpoint(anyString(), anyString());
    }

    @Test
    @DisplayName("Should answer 409 for a duplicate checkpoint name")
    void shouldReturnConflict_whenDuplicate() throws Exception {
      when(stateStore.checkpoint(RUN, "cp"))
          .thenThrow(new DuplicateCheckpointException(RUN, "cp"));

      mockMvc
          .perform(
              post("/api/runs/{runId}/checkpoints", RUN)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\":\"cp\"}"))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.code").value("CHECKPOINT_002"));
    }

    @Test
    @DisplayName("Should answer 404 when recovering from an unknown checkpoint")
    void shouldReturnNotFound_whenCheckpointUnknown() throws Exception {
      when(stateStore.recover(RUN, "missing"))
          .thenThrow(new CheckpointNotFoundException(RUN, "missing"));

      mockMvc
          .perform(post("/api/runs/{runId}/checkpoints/{name}/recover", RUN, "missing"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("CHECKPOINT_001"));
    }

    @Test
    @DisplayName("Should answer 422 with the issues of an inconsistent snapshot")
    void shouldReturnIssues_whenSnapshotInconsistent() throws Exception {
      when(stateStore.recover(RUN, "bad"))
          .thenThrow(
              new RecoveryException(
                  RUN, "bad", List.of("current section nowhere does not exist")));

      mockMvc
          .perform(post("/api/runs/{runId}/checkpoints/{name}/recover", RUN, "bad"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("CHECKPOINT_003"))
          .andExpect(jsonPath("$.details[0]").value("current section nowhere does not exist"));
    }
  }
}
