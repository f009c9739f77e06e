package com.flamingo.ai.coursegate.domain.enums;

/** Taxonomy of errors recorded in the pipeline error log. */
public enum ErrorKind {
  CLASSIFICATION,
  CONSTRAINT,
  QUOTA,
  STATE_CORRUPTION,
  STATE_INCONSISTENCY,
  GATE_AUTO_FAIL,
  IO
}
