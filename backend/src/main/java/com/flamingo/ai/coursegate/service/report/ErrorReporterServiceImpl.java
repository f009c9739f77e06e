package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.enums.FindingCategory;
import com.flamingo.ai.coursegate.domain.enums.Priority;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.model.Violation;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ErrorReporterService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ErrorReporterServiceImpl implements ErrorReporterService {

  private final SeverityTable severityTable;
  private final MeterRegistry meterRegistry;

  @Override
  public Report report(List<Violation> violations, List<Violation> warnings) {
    List<Finding> findings =
        Stream.concat(nullSafe(violations).stream(), nullSafe(warnings).stream())
            .map(this::toFinding)
            .toList();

    Map<RuleType, List<Finding>> byRule = new EnumMap<>(RuleType.class);
    findings.forEach(f -> byRule.computeIfAbsent(f.rule(), r -> new ArrayList<>()).add(f));

    List<ActionItem> actionItems = new ArrayList<>();
    byRule.forEach((rule, grouped) -> actionItems.add(toActionItem(rule, grouped)));
    actionItems.sort(
        Comparator.comparing(ActionItem::priority).thenComparing(ActionItem::rule));

    Priority overall =
        findings.stream()
            .map(Finding::priority)
            .min(Comparator.naturalOrder())
            .orElse(Priority.INFO);

    findings.forEach(
        f -> meterRegistry.counter("report.findings", "priority", f.priority().name()).increment());
    log.debug(
        "Report with {} finding(s), {} action item(s), overall {}",
        findings.size(),
        actionItems.size(),
        overall);
    return new Report(
        overall, overall.requiresImmediateAction(), findings, actionItems, Instant.now());
  }

  private Finding toFinding(Violation violation) {
    FindingCategory category = violation.rule().getCategory();
    Priority priority =
        severityTable.resolve(category, violation.rule(), violation.field(), violation.severity());
    return new Finding(
        category,
        violation.rule(),
        violation.field(),
        violation.location(),
        violation.message(),
        violation.severity(),
        priority);
  }

  private ActionItem toActionItem(RuleType rule, List<Finding> findings) {
    LinkedHashSet<String> locations = new LinkedHashSet<>();
    findings.stream()
        .map(Finding::location)
        .filter(location -> location != null)
        .forEach(locations::add);
    Priority highest =
        findings.stream().map(Finding::priority).min(Comparator.naturalOrder()).orElseThrow();
    return new ActionItem(
        rule,
        RemediationCatalog.description(rule),
        List.copyOf(locations),
        RemediationCatalog.checklist(rule),
        highest,
        findings.size());
  }

  private static List<Violation> nullSafe(List<Violation> list) {
    return list == null ? List.of() : list;
  }
}
