package com.flamingo.ai.coursegate.service.classification;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import com.flamingo.ai.coursegate.domain.model.Assignment;
import com.flamingo.ai.coursegate.domain.model.Category;
import com.flamingo.ai.coursegate.domain.model.CategoryCatalog;
import com.flamingo.ai.coursegate.domain.model.Flag;
import com.flamingo.ai.coursegate.domain.model.Item;
import com.flamingo.ai.coursegate.exception.ClassificationException;
import com.flamingo.ai.coursegate.service.classification.rules.ClassificationRule;
import com.flamingo.ai.coursegate.service.classification.rules.RuleOutcome;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ClassifierService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClassifierServiceImpl implements ClassifierService {

  static final String RETRY_NAME = "classification";

  private final PipelineConfig pipelineConfig;
  private final ClassificationRuleChain ruleChain;
  private final DependencyMapper dependencyMapper;
  private final RetryRegistry retryRegistry;
  private final MeterRegistry meterRegistry;

  @Override
  public Assignment classify(Item item, ClassificationContext context) {
    List<String> all = context.allCategoryIds();
    if (all.isEmpty()) {
      throw new IllegalArgumentException("Category catalog is empty");
    }

    // Categories supported by primary and secondary rules, with how many rules backed each
    Map<String, Integer> support = new LinkedHashMap<>();
    Map<RuleTier, Set<String>> supportByTier = new EnumMap<>(RuleTier.class);
    List<String> pool = null;
    ClassificationRule decidingRule = null;
    String chosen = null;

    for (ClassificationRule rule : ruleChain.rules()) {
      boolean tertiary = rule.tier() == RuleTier.TERTIARY;
      if (tertiary && pool == null) {
        pool = support.isEmpty() ? all : all.stream().filter(support::containsKey).toList();
      }
      List<String> contenders = tertiary ? pool : all;
      RuleOutcome outcome = rule.evaluate(item, context, contenders);

      if (outcome.isDecisive()) {
        if (!contenders.contains(outcome.winner())) {
          throw new IllegalStateException(
              "Rule " + rule.id() + " chose " + outcome.winner() + " outside its contenders");
        }
        decidingRule = rule;
        chosen = outcome.winner();
        break;
      }
      if (outcome.kind() == RuleOutcome.Kind.CONTESTED) {
        if (tertiary) {
          pool = outcome.categories();
        } else {
          outcome.categories().forEach(id -> support.merge(id, 1, Integer::sum));
          supportByTier
              .computeIfAbsent(rule.tier(), t -> new LinkedHashSet<>())
              .addAll(outcome.categories());
        }
      }
    }

    if (decidingRule == null) {
      throw new IllegalStateException("Rule chain ended without a decision for item " + item.id());
    }

    List<Flag> flags = new ArrayList<>();
    Set<Integer> dependents = context.dependentsOf(item.id());
    if (!dependents.isEmpty()) {
      flags.add(
          Flag.frontload(
              "defines terms used by items "
                  + dependents.stream().map(String::valueOf).collect(Collectors.joining(", "))));
    }
    if (decidingRule.tier() == RuleTier.TERTIARY && tiersDisagree(supportByTier)) {
      flags.add(Flag.ambiguous(rationale(chosen, support, decidingRule, context.catalog())));
    }
    int xrefMinimum = context.settings().getXrefMinimumHits();
    for (Category category : context.catalog().categories()) {
      if (!category.id().equals(chosen)
          && KeywordMatcher.hits(item.text(), category.routingKeywords()) >= xrefMinimum) {
        flags.add(Flag.xref(category.id()));
      }
    }

    log.debug(
        "Item {} -> {} by {} ({}), flags {}",
        item.id(),
        chosen,
        decidingRule.id(),
        decidingRule.tier(),
        flags);
    return new Assignment(item.id(), chosen, flags, decidingRule.id(), decidingRule.tier());
  }

  @Override
  public ClassificationResult classifyBatch(List<Item> items) {
    return classifyBatch(items, CategoryCatalog.from(pipelineConfig));
  }

  @Override
  @Timed(value = "classification.batch", description = "Time to classify a batch of items")
  public ClassificationResult classifyBatch(List<Item> items, CategoryCatalog catalog) {
    requireUniqueIds(items);
    log.info("Classifying {} item(s) into {} categories", items.size(), catalog.size());

    Retry retry = retryRegistry.retry(RETRY_NAME);
    ClassificationResult result;
    try {
      result = retry.executeSupplier(() -> runBatch(items, catalog));
    } catch (RuntimeException e) {
      meterRegistry.counter("classification.failures").increment();
      log.error("Classification of {} item(s) aborted: {}", items.size(), e.getMessage(), e);
      throw new ClassificationException("Classification aborted: " + e.getMessage(), e);
    }

    result.decisionsByTier()
        .forEach(
            (tier, count) ->
                meterRegistry
                    .counter("classification.decisions", "tier", tier.name())
                    .increment(count));
    result.assignments().stream()
        .flatMap(a -> a.flags().stream())
        .forEach(
            flag ->
                meterRegistry
                    .counter("classification.flags", "type", flag.type().name())
                    .increment());

    result.shortfalls()
        .forEach(
            s ->
                log.warn(
                    "Category {} has {} item(s), below minimum {}; flagged for review",
                    s.categoryId(),
                    s.assigned(),
                    s.minimum()));
    log.info("Classified {} item(s): {}", items.size(), result.distribution());
    return result;
  }

  private ClassificationResult runBatch(List<Item> items, CategoryCatalog catalog) {
    Map<Integer, Set<Integer>> dependents =
        dependencyMapper.mapDependencies(
            items, pipelineConfig.getClassification().getDefinitionCues());
    ClassificationContext context =
        new ClassificationContext(catalog, pipelineConfig.getClassification(), dependents);

    List<Assignment> assignments = new ArrayList<>(items.size());
    for (Item item : items) {
      assignments.add(classify(item, context));
    }

    // Batch invariants
    Set<Integer> assignedIds = new HashSet<>();
    for (Assignment assignment : assignments) {
      if (!assignedIds.add(assignment.itemId())) {
        throw new IllegalStateException("Item " + assignment.itemId() + " assigned twice");
      }
    }
    if (assignments.size() != items.size()) {
      throw new IllegalStateException(
          "Assigned " + assignments.size() + " of " + items.size() + " item(s)");
    }

    Map<String, Integer> distribution = new LinkedHashMap<>();
    catalog.ids().forEach(id -> distribution.put(id, 0));
    assignments.forEach(a -> distribution.merge(a.categoryId(), 1, Integer::sum));

    Map<RuleTier, Long> byTier = new EnumMap<>(RuleTier.class);
    assignments.forEach(a -> byTier.merge(a.decidingTier(), 1L, Long::sum));

    List<CategoryShortfall> shortfalls = new ArrayList<>();
    for (Category category : catalog.categories()) {
      int assigned = distribution.get(category.id());
      if (assigned < category.minimumPopulation()) {
        shortfalls.add(
            new CategoryShortfall(category.id(), assigned, category.minimumPopulation()));
      }
    }
    return new ClassificationResult(assignments, distribution, byTier, shortfalls);
  }

  /** True when at least two tiers contested the item and backed different categories. */
  private static boolean tiersDisagree(Map<RuleTier, Set<String>> supportByTier) {
    return supportByTier.size() >= 2 && new HashSet<>(supportByTier.values()).size() >= 2;
  }

  private String rationale(
      String chosen,
      Map<String, Integer> support,
      ClassificationRule rule,
      CategoryCatalog catalog) {
    String runnerUp =
        support.entrySet().stream()
            .filter(e -> !e.getKey().equals(chosen))
            .sorted(
                Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                    .reversed()
                    .thenComparingInt(e -> catalog.positionOf(e.getKey())))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElseThrow();
    return "tie between "
        + chosen
        + " and "
        + runnerUp
        + " resolved by "
        + rule.id()
        + "; runner-up: "
        + runnerUp
        + " ("
        + catalog.get(runnerUp).label()
        + ")";
  }

  private void requireUniqueIds(List<Item> items) {
    Set<Integer> seen = new HashSet<>();
    for (Item item : items) {
      if (!seen.add(item.id())) {
        throw new IllegalArgumentException("Duplicate item id: " + item.id());
      }
    }
  }
}
