package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.GateRequest;
import com.flamingo.ai.coursegate.api.dto.response.GateResponse;
import com.flamingo.ai.coursegate.domain.model.Violation;
import com.flamingo.ai.coursegate.service.gate.GateResult;
import com.flamingo.ai.coursegate.service.gate.QualityGateService;
import com.flamingo.ai.coursegate.service.gate.ScoreCategory;
import com.flamingo.ai.coursegate.service.report.ErrorReporterService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for gate evaluation and reporting. */
@RestController
@RequestMapping("/api/gate")
@RequiredArgsConstructor
public class GateController {

  private final QualityGateService qualityGateService;
  private final ErrorReporterService errorReporterService;

  /** Scores the findings and builds the prioritised report for them. */
  @PostMapping
  public ResponseEntity<GateResponse> evaluate(@Valid @RequestBody GateRequest request) {
    List<ScoreCategory> categories = nullSafe(request.getCategories());
    List<Violation> violations =
        categories.isEmpty()
            ? nullSafe(request.getViolations())
            : categories.stream()
                .flatMap(c -> c.violations().stream())
                .filter(Objects::nonNull)
                .toList();

    GateResult gate =
        categories.isEmpty()
            ? qualityGateService.evaluate(violations)
            : qualityGateService.score(categories);
    List<Violation> errors = violations.stream().filter(Violation::isError).toList();
    List<Violation> warnings = violations.stream().filter(v -> !v.isError()).toList();
    return ResponseEntity.ok(
        GateResponse.builder()
            .gate(gate)
            .report(errorReporterService.report(errors, warnings))
            .build());
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
