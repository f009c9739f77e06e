package com.flamingo.ai.coursegate.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursegate.service.validation.ConstraintValidationServiceImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("ValidationController Tests")
class ValidationControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    ValidationController controller =
        new ValidationController(
            new ConstraintValidationServiceImpl(
                PipelineConfigFixtures.standard(), meterRegistry));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should return violations as data with 200")
  void shouldReturnViolationsAsData() throws Exception {
    String body =
        """
        {"units":[
          {"id":"u1","type":"CONTENT","fields":{"header":"Heart failure"}},
          {"id":"u2","type":"CONTENT","fields":{"header":"Heart","body":"Assess"}}
        ]}
        """;

    mockMvc
        .perform(post("/api/validation").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.unitsChecked").value(2))
        .andExpect(jsonPath("$.unitsWithErrors").value(1))
        .andExpect(jsonPath("$.violations[0].rule").value("REQUIRED_FIELD"))
        .andExpect(jsonPath("$.violations[0].location").value("u1/body"));
  }

  @Test
  @DisplayName("Should reject an empty unit list")
  void shouldRejectEmptyUnits() throws Exception {
    mockMvc
        .perform(
            post("/api/validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"units\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"))
        .andExpect(jsonPath("$.details[0]").value("units: At least one unit is required"));
  }

  @Test
  @DisplayName("Should reject a unit without a type")
  void shouldRejectUnitWithoutType() throws Exception {
    mockMvc
        .perform(
            post("/api/validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"units\":[{\"id\":\"u1\",\"fields\":{}}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }
}
