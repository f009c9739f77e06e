package com.flamingo.ai.coursegate.domain.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An atomic unit of subject matter to be classified, e.g. one learning objective.
 *
 * <p>Ids are stable, unique and sequential within a batch. Items are never mutated after
 * creation.
 */
public record Item(int id, String text, int wordCount) {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public Item {
    Objects.requireNonNull(text, "text");
  }

  /** Creates an item, deriving the word count from the text. */
  public static Item of(int id, String text) {
    String trimmed = text == null ? "" : text.strip();
    int words = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    return new Item(id, trimmed, words);
  }
}
