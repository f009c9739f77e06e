package com.flamingo.ai.coursegate.service.gate;

import com.flamingo.ai.coursegate.domain.enums.Verdict;

/** Per-dimension line of a gate result. */
public record DimensionScore(
    String name,
    double rawScore,
    double weight,
    double contribution,
    Verdict verdict,
    int violationCount) {}
