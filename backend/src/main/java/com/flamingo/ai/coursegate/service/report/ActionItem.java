package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.enums.Priority;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import java.util.List;

/**
 * Deduplicated fix for every finding of one rule type.
 *
 * @param locations distinct affected locations, in the order first seen
 * @param remediation static checklist for the rule type
 * @param priority the highest priority among the grouped findings
 * @param count number of findings grouped here
 */
public record ActionItem(
    RuleType rule,
    String description,
    List<String> locations,
    List<String> remediation,
    Priority priority,
    int count) {}
