package com.flamingo.ai.coursegate.service.classification;

/** A category that ended a batch under its minimum population and needs reviewer attention. */
public record CategoryShortfall(String categoryId, int assigned, int minimum) {

  public int deficit() {
    return minimum - assigned;
  }
}
