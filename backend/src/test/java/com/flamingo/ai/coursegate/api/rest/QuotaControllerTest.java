package com.flamingo.ai.coursegate.api.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.coursegate.PipelineConfigFixtures;
import com.flamingo.ai.coursegate.exception.GlobalExceptionHandler;
import com.flamingo.ai.coursegate.service.quota.QuotaServiceImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@DisplayName("QuotaController Tests")
class QuotaControllerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new QuotaController(
                    new QuotaServiceImpl(PipelineConfigFixtures.standard(), meterRegistry)))
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should fail a collection below its band minimum")
  void shouldFailBelowMinimum() throws Exception {
    mockMvc
        .perform(
            post("/api/quota")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"collectionSize\":14,\"specialItemCount\":1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verdict").value("FAIL"))
        .andExpect(jsonPath("$.deficit").value(1));
  }

  @Test
  @DisplayName("Should add the diversity advisory without changing the verdict")
  void shouldAddDiversityAdvisory() throws Exception {
    mockMvc
        .perform(
            post("/api/quota")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"collectionSize\":14,"
                        + "\"specialItemSubTypes\":[\"diagram\",\"diagram\",\"diagram\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verdict").value("PASS"))
        .andExpect(jsonPath("$.specialItemCount").value(3))
        .andExpect(jsonPath("$.violations[0].rule").value("QUOTA_DIVERSITY"));
  }

  @Test
  @DisplayName("Should reject a request with neither count nor sub-types")
  void shouldRejectMissingCount() throws Exception {
    mockMvc
        .perform(
            post("/api/quota")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"collectionSize\":14}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should reject a negative collection size")
  void shouldRejectNegativeSize() throws Exception {
    mockMvc
        .perform(
            post("/api/quota")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"collectionSize\":-1,\"specialItemCount\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }
}
