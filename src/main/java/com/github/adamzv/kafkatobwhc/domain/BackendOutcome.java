package com.github.adamzv.kafkatobwhc.domain;

/**
 * Result of a single backend call.
 */
public sealed interface BackendOutcome permits BackendOutcome.Success, BackendOutcome.TransportFailure {

  /**
   * Status reported when the backend could not be reached. Lies outside the HTTP status range
   * and is part of the contract with the ETL processor.
   */
  int NO_CONNECTION_STATUS = 900;

  /**
   * The backend answered. The status is not interpreted; 4xx and 5xx land here as well.
   */
  record Success(int statusCode, byte[] body) implements BackendOutcome {}

  /**
   * No response was received: connection refused, timeout or another I/O failure.
   */
  record TransportFailure(String reason) implements BackendOutcome {}
}
