package com.github.adamzv.kafkatobwhc.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.adamzv.kafkatobwhc.domain.BackendOutcome;
import com.github.adamzv.kafkatobwhc.domain.OutboundRecord;
import com.github.adamzv.kafkatobwhc.domain.Problems;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ResponseEnvelopeBuilder {

  private final ObjectMapper objectMapper;

  public ResponseEnvelopeBuilder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public OutboundRecord buildResponse(byte[] originalKey, BackendOutcome outcome) {
    if (outcome instanceof BackendOutcome.Success success) {
      byte[] body = success.body() == null ? new byte[0] : success.body();
      return new OutboundRecord(originalKey, body, success.statusCode());
    }
    BackendOutcome.TransportFailure failure = (BackendOutcome.TransportFailure) outcome;
    return new OutboundRecord(originalKey, noConnectionDocument(failure.reason()), BackendOutcome.NO_CONNECTION_STATUS);
  }

  private byte[] noConnectionDocument(String reason) {
    ObjectNode document = objectMapper.createObjectNode();
    document.put("status", BackendOutcome.NO_CONNECTION_STATUS);
    document.put("reason", reason == null || reason.isBlank() ? "no connection" : reason);
    try {
      return objectMapper.writeValueAsBytes(document);
    } catch (JsonProcessingException ex) {
      throw Problems.operationFailed("Could not serialize failure response", Map.of("reason", String.valueOf(reason)), ex);
    }
  }
}
