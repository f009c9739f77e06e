package com.flamingo.ai.coursegate.api.dto.request;

import com.flamingo.ai.coursegate.domain.model.Violation;
import com.flamingo.ai.coursegate.service.gate.ScoreCategory;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a gate evaluation. Pre-scored categories take precedence; otherwise the
 * violations are scored with the configured rubric.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GateRequest {

  @Builder.Default private List<@Valid Violation> violations = new ArrayList<>();

  @Builder.Default private List<@Valid ScoreCategory> categories = new ArrayList<>();
}
