package com.flamingo.ai.coursegate.domain.model;

import com.flamingo.ai.coursegate.domain.enums.FlagType;

/**
 * Annotation attached to an assignment. Flags never change which category an item is assigned
 * to.
 *
 * @param type the flag kind
 * @param detail rationale for {@code AMBIGUOUS}, the related category id for {@code XREF}, the
 *     dependent item ids for {@code FRONTLOAD}
 */
public record Flag(FlagType type, String detail) {

  public static Flag frontload(String dependents) {
    return new Flag(FlagType.FRONTLOAD, dependents);
  }

  public static Flag ambiguous(String rationale) {
    if (rationale == null || rationale.isBlank()) {
      throw new IllegalArgumentException("AMBIGUOUS flag requires a rationale");
    }
    return new Flag(FlagType.AMBIGUOUS, rationale);
  }

  public static Flag xref(String categoryId) {
    return new Flag(FlagType.XREF, categoryId);
  }
}
