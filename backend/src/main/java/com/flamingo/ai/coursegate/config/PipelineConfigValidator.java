package com.flamingo.ai.coursegate.config;

import com.flamingo.ai.coursegate.config.PipelineConfig.Band;
import com.flamingo.ai.coursegate.config.PipelineConfig.CategoryDefinition;
import com.flamingo.ai.coursegate.config.PipelineConfig.Dimension;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/** Rejects an inconsistent pipeline configuration at startup. */
@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineConfigValidator implements InitializingBean {

  static final int MIN_CATEGORIES = 4;
  static final int MAX_CATEGORIES = 6;

  private final PipelineConfig pipelineConfig;

  @Override
  public void afterPropertiesSet() {
    List<String> problems = validate(pipelineConfig);
    if (!problems.isEmpty()) {
      throw new IllegalStateException("Invalid pipeline configuration: " + problems);
    }
    log.info(
        "Pipeline configuration loaded: {} categories, {} quota bands, {} gate dimensions",
        pipelineConfig.getCategories().size(),
        pipelineConfig.getQuota().getBands().size(),
        pipelineConfig.getGate().getDimensions().size());
  }

  /** Returns every problem found; an empty list means the configuration is usable. */
  public static List<String> validate(PipelineConfig config) {
    List<String> problems = new ArrayList<>();
    checkCategories(config.getCategories(), problems);
    checkBands(config.getQuota().getBands(), problems);
    checkGate(config.getGate(), problems);
    if (config.getState().getSteps().isEmpty()) {
      problems.add("state.steps must not be empty");
    }
    if (config.getWorkers().getPoolSize() < 1) {
      problems.add("workers.pool-size must be at least 1");
    }
    return problems;
  }

  private static void checkCategories(List<CategoryDefinition> categories, List<String> problems) {
    if (categories.size() < MIN_CATEGORIES || categories.size() > MAX_CATEGORIES) {
      problems.add(
          "expected "
              + MIN_CATEGORIES
              + "-"
              + MAX_CATEGORIES
              + " categories but found "
              + categories.size());
    }
    Set<String> ids = new HashSet<>();
    for (CategoryDefinition category : categories) {
      if (category.getId() == null || category.getId().isBlank()) {
        problems.add("category without id");
      } else if (!ids.add(category.getId())) {
        problems.add("duplicate category id " + category.getId());
      }
      if (category.getMinimumPopulation() < 0) {
        problems.add("negative minimum population for " + category.getId());
      }
      checkKeywords(category.getRoutingKeywords(), "routing", category.getId(), problems);
      if (category.getFocusKeywords() != null) {
        category
            .getFocusKeywords()
            .forEach(
                (focus, keywords) ->
                    checkKeywords(keywords, focus + " focus", category.getId(), problems));
      }
      checkKeywords(category.getFoundationKeywords(), "foundation", category.getId(), problems);
    }
  }

  /** A blank keyword matches at every offset of every item. */
  private static void checkKeywords(
      List<String> keywords, String kind, String categoryId, List<String> problems) {
    if (keywords != null && keywords.stream().anyMatch(k -> k == null || k.isBlank())) {
      problems.add("blank " + kind + " keyword in category " + categoryId);
    }
  }

  private static void checkBands(List<Band> bands, List<String> problems) {
    for (int i = 0; i < bands.size(); i++) {
      Band band = bands.get(i);
      String name = "band " + band.getMinSize() + "-" + band.getMaxSize();
      if (band.getMaxSize() != null && band.getMaxSize() < band.getMinSize()) {
        problems.add(name + " ends before it starts");
      }
      if (!(band.getMinimum() <= band.getTargetMin()
          && band.getTargetMin() <= band.getTargetMax())) {
        problems.add(name + " needs minimum <= targetMin <= targetMax");
      }
      if (i > 0) {
        Band previous = bands.get(i - 1);
        if (previous.getMaxSize() == null) {
          problems.add("open-ended band must be last");
        } else if (band.getMinSize() != previous.getMaxSize() + 1) {
          problems.add(
              name
                  + (band.getMinSize() <= previous.getMaxSize()
                      ? " overlaps"
                      : " leaves a gap after")
                  + " band ending at "
                  + previous.getMaxSize());
        }
      }
    }
  }

  private static void checkGate(PipelineConfig.Gate gate, List<String> problems) {
    if (gate.getWarnThreshold() > gate.getPassThreshold()) {
      problems.add("gate.warn-threshold must not exceed gate.pass-threshold");
    }
    if (gate.getDimensionWarnScore() > gate.getDimensionPassScore()) {
      problems.add("gate.dimension-warn-score must not exceed gate.dimension-pass-score");
    }
    if (gate.getMaxRevisionIterations() < 1) {
      problems.add("gate.max-revision-iterations must be at least 1");
    }
    if (!gate.getDimensions().isEmpty()) {
      double sum = gate.getDimensions().values().stream().mapToDouble(Dimension::getWeight).sum();
      if (Math.abs(sum - 1.0) > 1e-6) {
        problems.add("gate dimension weights sum to " + sum + ", expected 1.0");
      }
    }
  }
}
