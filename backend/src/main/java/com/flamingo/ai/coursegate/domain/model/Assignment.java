package com.flamingo.ai.coursegate.domain.model;

import com.flamingo.ai.coursegate.domain.enums.FlagType;
import com.flamingo.ai.coursegate.domain.enums.RuleTier;
import java.util.List;
import java.util.Optional;

/** The classification decision for one item. Exactly one exists per item in a batch. */
public record Assignment(
    int itemId, String categoryId, List<Flag> flags, String decidingRuleId, RuleTier decidingTier) {

  public Assignment {
    flags = flags == null ? List.of() : List.copyOf(flags);
  }

  public boolean hasFlag(FlagType type) {
    return flags.stream().anyMatch(flag -> flag.type() == type);
  }

  public Optional<Flag> flag(FlagType type) {
    return flags.stream().filter(flag -> flag.type() == type).findFirst();
  }
}
