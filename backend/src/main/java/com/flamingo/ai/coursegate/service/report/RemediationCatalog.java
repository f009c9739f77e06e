package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.enums.RuleType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Static action descriptions and fix checklists per rule type. */
final class RemediationCatalog {

  private static final Map<RuleType, String> DESCRIPTIONS = new EnumMap<>(RuleType.class);
  private static final Map<RuleType, List<String>> CHECKLISTS = new EnumMap<>(RuleType.class);

  static {
    register(
        RuleType.REQUIRED_FIELD,
        "Add the missing required fields",
        "Check the unit type's required fields",
        "Fill every missing or blank field with content",
        "Re-run validation on the unit");
    register(
        RuleType.LINE_LIMIT,
        "Reduce line count to the field maximum",
        "Merge or remove the least essential lines",
        "Move supporting detail into presenter notes",
        "Split the content across two units if it cannot be condensed");
    register(
        RuleType.CHAR_LIMIT,
        "Shorten lines that exceed the character limit",
        "Abbreviate or rephrase long lines",
        "Break long lines at a natural pause",
        "Keep each line to a single idea");
    register(
        RuleType.WORD_MINIMUM,
        "Expand fields that are below their word minimum",
        "Add an example or explanation",
        "Confirm the field covers its intended content");
    register(
        RuleType.WORD_MAXIMUM,
        "Trim fields that exceed their word maximum",
        "Remove repetition and filler",
        "Move secondary detail to another unit",
        "Recount words after editing");
    register(
        RuleType.MARKER_MINIMUM,
        "Insert the required marker tokens",
        "Place markers at natural transitions",
        "Confirm the marker spelling matches the configured token");
    register(
        RuleType.QUOTA_MINIMUM,
        "Add special items to reach the band minimum",
        "Identify units that can carry a special item",
        "Convert or add units until the deficit is cleared");
    register(
        RuleType.QUOTA_TARGET,
        "Bring the special-item count into the target range",
        "Add or remove special items as indicated",
        "Spread special items evenly through the collection");
    register(
        RuleType.QUOTA_SHARE,
        "Reduce the share of special items",
        "Replace the weakest special items with regular units");
    register(
        RuleType.QUOTA_DIVERSITY,
        "Vary the sub-types of special items",
        "Replace some special items with a different sub-type");
    register(
        RuleType.QUOTA_BAND_MISSING,
        "Configure a quota band covering the collection size",
        "Extend the quota table so bands are contiguous",
        "Re-run the quota check");
    register(
        RuleType.CATEGORY_POPULATION,
        "Review under-populated categories",
        "Confirm the input covers the category",
        "Reclassify borderline items if appropriate");
  }

  private RemediationCatalog() {}

  private static void register(RuleType rule, String description, String... checklist) {
    DESCRIPTIONS.put(rule, description);
    CHECKLISTS.put(rule, List.of(checklist));
  }

  static String description(RuleType rule) {
    return DESCRIPTIONS.getOrDefault(rule, "Resolve " + rule + " findings");
  }

  static List<String> checklist(RuleType rule) {
    return CHECKLISTS.getOrDefault(rule, List.of());
  }
}
