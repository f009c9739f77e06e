package com.flamingo.ai.coursegate;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.config.PipelineConfigValidator;
import com.flamingo.ai.coursegate.service.classification.ClassifierService;
import com.flamingo.ai.coursegate.service.gate.QualityGateService;
import com.flamingo.ai.coursegate.service.pipeline.SectionPipelineService;
import com.flamingo.ai.coursegate.service.quota.QuotaService;
import com.flamingo.ai.coursegate.service.report.ErrorReporterService;
import com.flamingo.ai.coursegate.service.state.StateStore;
import com.flamingo.ai.coursegate.service.validation.ConstraintValidationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads with the bundled configuration. State is kept
 * under the build directory so the test never touches a real data directory.
 */
@SpringBootTest(properties = "pipeline.state.base-path=target/test-state")
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private PipelineConfig pipelineConfig;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ClassifierService.class)).isNotNull();
    assertThat(applicationContext.getBean(ConstraintValidationService.class)).isNotNull();
    assertThat(applicationContext.getBean(QuotaService.class)).isNotNull();
    assertThat(applicationContext.getBean(QualityGateService.class)).isNotNull();
    assertThat(applicationContext.getBean(ErrorReporterService.class)).isNotNull();
    assertThat(applicationContext.getBean(StateStore.class)).isNotNull();
    assertThat(applicationContext.getBean(SectionPipelineService.class)).isNotNull();
  }

  @Test
  @DisplayName("Bundled configuration should bind and validate")
  void bundledConfigurationShouldBind() {
    assertThat(pipelineConfig.getCategories()).hasSize(6);
    assertThat(pipelineConfig.getGate().getDimensions())
        .containsKeys("structure", "line_count", "character_count", "visual_quota");
    assertThat(pipelineConfig.getState().getBasePath()).isEqualTo("target/test-state");
    assertThat(PipelineConfigValidator.validate(pipelineConfig)).isEmpty();
  }
}
