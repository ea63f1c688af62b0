package com.github.adamzv.kafkatobwhc.domain;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;

/**
 * The consent block of an MTB-File: {@code {"consent": {"patient": "...", "status": "active"}}}.
 * Nothing else of the document is read.
 */
public record MtbFileConsent(String patientId, Status status) {

  public enum Status {
    ACTIVE("active"),
    REJECTED("rejected");

    private final String value;

    Status(String value) {
      this.value = value;
    }

    static Optional<Status> fromValue(String value) {
      for (Status status : values()) {
        if (status.value.equals(value)) {
          return Optional.of(status);
        }
      }
      return Optional.empty();
    }
  }

  public boolean hasConsent() {
    return status == Status.ACTIVE;
  }

  /**
   * Returns the consent of the given payload, or empty if the payload is not JSON or carries
   * no readable consent.
   */
  public static Optional<MtbFileConsent> read(ObjectMapper objectMapper, byte[] payload) {
    if (payload == null || payload.length == 0) {
      return Optional.empty();
    }
    JsonNode root;
    try {
      root = objectMapper.reader()
          .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .readTree(payload);
    } catch (IOException ex) {
      return Optional.empty();
    }
    if (root == null || !root.isObject()) {
      return Optional.empty();
    }
    JsonNode consent = root.path("consent");
    JsonNode patient = consent.path("patient");
    if (!patient.isTextual() || patient.asText().isBlank()) {
      return Optional.empty();
    }
    return Status.fromValue(consent.path("status").asText(null))
        .map(status -> new MtbFileConsent(patient.asText(), status));
  }
}
