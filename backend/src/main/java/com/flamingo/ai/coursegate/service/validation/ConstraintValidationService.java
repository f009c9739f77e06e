package com.flamingo.ai.coursegate.service.validation;

import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.model.ContentUnit;
import com.flamingo.ai.coursegate.domain.model.Violation;
import java.util.List;

/** Checks content units against the structural and content limits of the configuration. */
public interface ConstraintValidationService {

  /**
   * Validates one unit against the given limits. The unit is never modified; an empty list means
   * the unit conforms.
   *
   * @param unit the content unit to check
   * @param limits field limits and required fields
   * @return all violations found, in field order
   */
  List<Violation> validate(ContentUnit unit, PipelineConfig.Limits limits);

  /** Validates one unit against the configured limits. */
  List<Violation> validate(ContentUnit unit);

  /** Validates every unit and aggregates counts by field and by rule. */
  ValidationResult validateAll(List<ContentUnit> units);
}
