package com.flamingo.ai.coursegate.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursegate.service.gate.DimensionFloorCondition;
import com.flamingo.ai.coursegate.service.gate.ExcessiveViolationsCondition;
import com.flamingo.ai.coursegate.service.gate.MissingRequiredElementCondition;
import com.flamingo.ai.coursegate.service.gate.QualityGateServiceImpl;
import com.flamingo.ai.coursegate.service.gate.RubricScorer;
import com.flamingo.ai.coursegate.service.report.ErrorReporterServiceImpl;
import com.flamingo.ai.coursegate.service.report.SeverityTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("GateController Tests")
class GateControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    PipelineConfig config = PipelineConfigFixtures.standard();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    GateController controller =
        new GateController(
            new QualityGateServiceImpl(
                config,
                new RubricScorer(config),
                List.of(
                    new MissingRequiredElementCondition(),
                    new DimensionFloorCondition(),
                    new ExcessiveViolationsCondition()),
                meterRegistry),
            new ErrorReporterServiceImpl(new SeverityTable(config), meterRegistry));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should pass a section without findings")
  void shouldPassWithoutFindings() throws Exception {
    mockMvc
        .perform(
            post("/api/gate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"violations\":[]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.gate.status").value("PASS"))
        .andExpect(jsonPath("$.gate.weightedTotal").value(100.0))
        .andExpect(jsonPath("$.report.findings").isEmpty());
  }

  @Test
  @DisplayName("Should fail and report a missing required field as critical")
  void shouldFailOnMissingRequiredField() throws Exception {
    String body =
        """
        {"violations":[{"location":"u1/body","rule":"REQUIRED_FIELD","severity":"ERROR",
          "message":"required field 'body' is missing","field":"body"}]}
        """;

    mockMvc
        .perform(post("/api/gate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.gate.status").value("FAIL"))
        .andExpect(jsonPath("$.gate.autoFailReasons[0]").value("missing-required-element: u1/body"))
        .andExpect(jsonPath("$.report.overallSeverity").value("CRITICAL"))
        .andExpect(jsonPath("$.report.requiresImmediateAction").value(true));
  }

  @Test
  @DisplayName("Should reject score categories whose weights do not sum to one")
  void shouldRejectBadWeights() throws Exception {
    String body =
        """
        {"categories":[{"name":"content","rawScore":90,"weight":0.5,"violations":[]}]}
        """;

    mockMvc
        .perform(post("/api/gate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should reject a violation without a rule")
  void shouldRejectViolationWithoutRule() throws Exception {
    String body =
        """
        {"violations":[{"location":"u1/body","severity":"ERROR","message":"too long"}]}
        """;

    mockMvc
        .perform(post("/api/gate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(
            jsonPath("$.details[0]").value("violations[0].rule: Violation rule is required"));
  }

  @Test
  @DisplayName("Should reject a scored violation without a severity")
  void shouldRejectScoredViolationWithoutSeverity() throws Exception {
    String body =
        """
        {"categories":[{"name":"content","rawScore":90,"weight":1.0,
          "violations":[{"location":"u1/body","rule":"LINE_LIMIT"}]}]}
        """;

    mockMvc
        .perform(post("/api/gate").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(
            jsonPath("$.details[0]")
                .value("categories[0].violations[0].severity: Violation severity is required"));
  }
}
