package com.flamingo.ai.coursegate.domain.enums;

/** Kind of annotation attached to a classification decision. */
public enum FlagType {
  /** Item defines something other items depend on; deliver it first. */
  FRONTLOAD,

  /** A tie between categories was resolved by a tertiary rule. */
  AMBIGUOUS,

  /** Item is also relevant to another category; it is still emitted once. */
  XREF
}
