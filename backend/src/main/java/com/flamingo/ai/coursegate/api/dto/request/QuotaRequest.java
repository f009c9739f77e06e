package com.flamingo.ai.coursegate.api.dto.request;

import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a quota check. When sub-types are given their count is the special-item count
 * and the diversity advisory is evaluated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaRequest {

  @Min(value = 0, message = "Collection size must not be negative")
  private int collectionSize;

  @Min(value = 0, message = "Special item count must not be negative")
  private Integer specialItemCount;

  private List<String> specialItemSubTypes;
}
