package com.github.adamzv.kafkatobwhc.domain;

import java.util.Map;

public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {

  public Problem {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
