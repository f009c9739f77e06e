package com.flamingo.ai.coursegate.domain.state;

import com.flamingo.ai.coursegate.domain.enums.ErrorKind;
import java.time.Instant;

/** One entry of the append-only pipeline error log. */
public record ErrorEntry(
    Instant timestamp, ErrorKind kind, String section, String step, String message) {

  public static ErrorEntry of(ErrorKind kind, String section, String step, String message) {
    return new ErrorEntry(Instant.now(), kind, section, step, message);
  }
}
