package com.flamingo.ai.coursegate.service.quota;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import java.util.List;

/** Checks how many special items a collection carries against its size band. */
public interface QuotaService {

  /**
   * Selects the band covering {@code collectionSize} and grades the special-item count against
   * its minimum and target range.
   */
  QuotaResult checkQuota(int collectionSize, int specialItemCount, PipelineConfig.Quota quotaTable);

  /** Checks against the configured quota table. */
  QuotaResult checkQuota(int collectionSize, int specialItemCount);

  /**
   * Checks against the configured quota table, using the sub-type of each special item to add a
   * diversity advisory when all of them share one sub-type.
   */
  QuotaResult checkQuota(int collectionSize, List<String> specialItemSubTypes);
}
