package com.flamingo.ai.coursegate.domain.enums;

/** Tier of a classification rule. Tiers are consulted in declaration order. */
public enum RuleTier {
  PRIMARY,
  SECONDARY,
  TERTIARY
}
