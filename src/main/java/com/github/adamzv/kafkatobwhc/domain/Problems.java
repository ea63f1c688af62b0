package com.github.adamzv.kafkatobwhc.domain;

import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException payloadTooLarge(String message, Map<String, Object> details) {
    return raise(ProblemCodes.PAYLOAD_TOO_LARGE, message, details, null);
  }

  public static ProblemException kafkaUnavailable(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.KAFKA_UNAVAILABLE, message, details, cause);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
