package com.github.adamzv.kafkatobwhc.domain;

public final class ProblemCodes {
  public static final String PAYLOAD_TOO_LARGE = "PAYLOAD_TOO_LARGE";
  public static final String KAFKA_UNAVAILABLE = "KAFKA_UNAVAILABLE";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  private ProblemCodes() {
  }
}
