package com.flamingo.ai.coursegate.service.pipeline;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;
import com.flamingo.ai.coursegate.service.classification.ClassificationResult;
import com.flamingo.ai.coursegate.service.gate.GateResult;
import com.flamingo.ai.coursegate.service.gate.RevisionDecision;
import com.flamingo.ai.coursegate.service.quota.QuotaResult;
import com.flamingo.ai.coursegate.service.report.Report;
import lombok.Builder;

/**
 * Result of running one section. Components that did not run leave their field {@code null}.
 *
 * @param skipped true when the section was already complete or a stop was requested
 */
@Builder
public record SectionOutcome(
    String section,
    PipelineStatus status,
    boolean skipped,
    ClassificationResult classification,
    QuotaResult quota,
    GateResult gate,
    Report report,
    RevisionDecision decision,
    String error) {}
