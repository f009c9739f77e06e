package com.flamingo.ai.coursegate.service.report;

import com.flamingo.ai.coursegate.domain.enums.FindingCategory;
import com.flamingo.ai.coursegate.domain.enums.Priority;
import com.flamingo.ai.coursegate.domain.enums.RuleType;
import com.flamingo.ai.coursegate.domain.enums.Severity;

/** A violation after categorisation and priority assignment. */
public record Finding(
    FindingCategory category,
    RuleType rule,
    String field,
    String location,
    String message,
    Severity severity,
    Priority priority) {}
