package com.flamingo.ai.coursegate.api.rest;

import com.flamingo.ai.coursegate.api.dto.request.ContentUnitRequest;
import com.flamingo.ai.coursegate.api.dto.request.ValidateRequest;
import com.flamingo.ai.coursegate.service.validation.ConstraintValidationService;
import com.flamingo.ai.coursegate.service.validation.ValidationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for content unit validation. */
@RestController
@RequestMapping("/api/validation")
@RequiredArgsConstructor
public class ValidationController {

  private final ConstraintValidationService validationService;

  /** Validates units against the configured limits. Violations are data, never an error status. */
  @PostMapping
  public ResponseEntity<ValidationResult> validate(@Valid @RequestBody ValidateRequest request) {
    return ResponseEntity.ok(
        validationService.validateAll(
            request.getUnits().stream().map(ContentUnitRequest::toContentUnit).toList()));
  }
}
