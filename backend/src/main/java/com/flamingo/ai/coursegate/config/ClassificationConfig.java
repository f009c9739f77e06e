package com.flamingo.ai.coursegate.config;

import com.flamingo.ai.coursegate.service.classification.ClassificationRuleChain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the classification rule cascade. */
@Configuration
@Slf4j
public class ClassificationConfig {

  @Bean
  public ClassificationRuleChain classificationRuleChain(PipelineConfig pipelineConfig) {
    ClassificationRuleChain chain =
        ClassificationRuleChain.standard(pipelineConfig.getClassification());
    log.info("Classification rules in order: {}", chain.ruleIds());
    return chain;
  }
}
