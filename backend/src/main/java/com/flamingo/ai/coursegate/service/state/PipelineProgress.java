package com.flamingo.ai.coursegate.service.state;

import com.flamingo.ai.coursegate.domain.enums.PipelineStatus;

/** Step-level progress summary of a run. */
public record PipelineProgress(
    String runId,
    PipelineStatus status,
    String currentSection,
    String currentStep,
    int totalSections,
    int completedSections,
    int failedSections,
    int totalSteps,
    int completedSteps,
    int inProgressSteps,
    int failedSteps,
    double percentComplete) {}
