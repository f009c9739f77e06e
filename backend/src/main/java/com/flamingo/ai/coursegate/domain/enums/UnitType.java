package com.flamingo.ai.coursegate.domain.enums;

/** Declared type of a generated content unit. */
public enum UnitType {
  SECTION_INTRO,
  CONTENT,
  VIGNETTE,
  ANSWER,
  VISUAL
}
