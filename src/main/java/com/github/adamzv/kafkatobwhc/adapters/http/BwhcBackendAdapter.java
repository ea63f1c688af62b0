package com.github.adamzv.kafkatobwhc.adapters.http;

import com.github.adamzv.kafkatobwhc.domain.BackendOutcome;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.ports.BackendPort;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class BwhcBackendAdapter implements BackendPort {

  static final String MTB_FILE_PATH = "/MTBFile";

  private final RestClient restClient;
  private final BridgeConfig config;

  public BwhcBackendAdapter(RestClient bwhcRestClient, BridgeConfig config) {
    this.restClient = bwhcRestClient;
    this.config = config;
  }

  @Override
  public BackendOutcome forward(byte[] payload) {
    return call(() -> restClient.post()
        .uri(MTB_FILE_PATH)
        .contentType(MediaType.APPLICATION_JSON)
        .body(payload == null ? new byte[0] : payload)
        .exchange(this::toSuccess));
  }

  @Override
  public BackendOutcome delete(String patientId) {
    return call(() -> restClient.delete()
        .uri(MTB_FILE_PATH + "/{patientId}", patientId)
        .header("Content-Type", MediaType.APPLICATION_JSON_VALUE)
        .exchange(this::toSuccess));
  }

  private BackendOutcome call(Supplier<BackendOutcome> request) {
    try {
      return request.get();
    } catch (RestClientException ex) {
      return new BackendOutcome.TransportFailure(describe(ex));
    }
  }

  private BackendOutcome toSuccess(HttpRequest request, ClientHttpResponse response) throws IOException {
    byte[] body = StreamUtils.copyToByteArray(response.getBody());
    return new BackendOutcome.Success(response.getStatusCode().value(), body);
  }

  String describe(Throwable failure) {
    if (causedBy(failure, UnknownHostException.class) || causedBy(failure, UnresolvedAddressException.class)) {
      return "unknown host " + config.backendUri().getHost();
    }
    if (causedBy(failure, SocketTimeoutException.class)
        || causedBy(failure, HttpTimeoutException.class)
        || causedBy(failure, TimeoutException.class)) {
      return "timed out after " + config.backendTimeout().toMillis() + "ms";
    }
    if (causedBy(failure, ConnectException.class)) {
      return "connection refused";
    }
    Throwable innermost = failure;
    while (innermost.getCause() != null) {
      innermost = innermost.getCause();
    }
    String message = innermost.getMessage();
    return message == null || message.isBlank() ? innermost.getClass().getSimpleName() : message;
  }

  private static boolean causedBy(Throwable failure, Class<? extends Throwable> type) {
    for (Throwable current = failure; current != null; current = current.getCause()) {
      if (type.isInstance(current)) {
        return true;
      }
    }
    return false;
  }
}
