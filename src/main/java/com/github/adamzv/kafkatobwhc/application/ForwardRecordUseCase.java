package com.github.adamzv.kafkatobwhc.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkatobwhc.domain.BackendOutcome;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.domain.InboundRecord;
import com.github.adamzv.kafkatobwhc.domain.MtbFileConsent;
import com.github.adamzv.kafkatobwhc.domain.OutboundRecord;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import com.github.adamzv.kafkatobwhc.domain.PublishResult;
import com.github.adamzv.kafkatobwhc.ports.BackendPort;
import com.github.adamzv.kafkatobwhc.ports.ResponsePublisherPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Forwards one inbound record to the backend and publishes the response under the same key.
 * A backend that cannot be reached is a regular outcome; only a failed publish is thrown.
 */
@Component
public class ForwardRecordUseCase {

  private static final Logger log = LoggerFactory.getLogger(ForwardRecordUseCase.class);

  private final BackendPort backendPort;
  private final ResponsePublisherPort publisherPort;
  private final ResponseEnvelopeBuilder envelopeBuilder;
  private final ObjectMapper objectMapper;
  private final BridgeConfig config;
  private final MeterRegistry meterRegistry;

  public ForwardRecordUseCase(
      BackendPort backendPort,
      ResponsePublisherPort publisherPort,
      ResponseEnvelopeBuilder envelopeBuilder,
      ObjectMapper objectMapper,
      BridgeConfig config,
      MeterRegistry meterRegistry) {
    this.backendPort = backendPort;
    this.publisherPort = publisherPort;
    this.envelopeBuilder = envelopeBuilder;
    this.objectMapper = objectMapper;
    this.config = config;
    this.meterRegistry = meterRegistry;
  }

  public PublishResult execute(InboundRecord record) {
    Instant start = Instant.now();
    Optional<MtbFileConsent> consent = MtbFileConsent.read(objectMapper, record.value());
    boolean delete = consent.isPresent() && !consent.get().hasConsent();
    String method = delete ? "DELETE" : "POST";

    Timer.Sample sample = Timer.start(meterRegistry);
    BackendOutcome outcome = delete
        ? backendPort.delete(consent.get().patientId())
        : backendPort.forward(record.value());
    sample.stop(meterRegistry.timer("bwhc_bridge_backend_duration_seconds", "method", method));

    boolean reached = outcome instanceof BackendOutcome.Success;
    meterRegistry.counter("bwhc_bridge_records_total", "outcome", reached ? "success" : "no_connection")
        .increment();
    if (!reached) {
      log.warn(
          "backend_unreachable key={} method={} reason={}",
          describeKey(record.key()),
          method,
          ((BackendOutcome.TransportFailure) outcome).reason()
      );
    }

    OutboundRecord response = envelopeBuilder.buildResponse(record.key(), outcome);
    PublishResult result;
    try {
      result = publisherPort.publish(config.responseTopic(), response);
    } catch (ProblemException ex) {
      meterRegistry.counter("bwhc_bridge_publish_failures_total").increment();
      log.error(
          "record_publish_failed key={} source={}-{}@{} code={} message={}",
          describeKey(record.key()),
          record.topic(),
          record.partition(),
          record.offset(),
          ex.problem().code(),
          ex.problem().message()
      );
      throw ex;
    }

    log.info(
        "record_forwarded key={} source={}-{}@{} method={} status={} target={}-{}@{} durationMs={}",
        describeKey(record.key()),
        record.topic(),
        record.partition(),
        record.offset(),
        method,
        response.statusCode(),
        result.topic(),
        result.partition(),
        result.offset(),
        Duration.between(start, Instant.now()).toMillis()
    );
    return result;
  }

  static String describeKey(byte[] key) {
    return key == null ? "<none>" : new String(key, StandardCharsets.UTF_8);
  }
}
