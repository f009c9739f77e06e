package com.flamingo.ai.coursegate.domain.enums;

/** Result of validating a persisted pipeline state. */
public enum StateHealth {
  /** Parseable, schema-valid and internally consistent. */
  VALID,

  /** Parseable but inconsistent; may be repairable by re-deriving fields. */
  INVALID,

  /** Unparseable or schema-invalid; only a checkpoint can restore it. */
  CORRUPTED
}
