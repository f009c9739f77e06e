package com.flamingo.ai.coursegate.service.quota;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.enums.Verdict;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;

/**
 * Outcome of a quota check.
 *
 * @param band the size band that applied, or {@code null} when no band covers the size
 * @param deficit how many special items are missing to reach the band minimum; zero otherwise
 * @param violations the failure and every advisory, in the order they were found
 */
public record QuotaResult(
    Verdict verdict,
    int collectionSize,
    int specialItemCount,
    PipelineConfig.Band band,
    int deficit,
    List<Violation> violations) {

  public boolean isBlocking() {
    return verdict.isBlocking();
  }
}
