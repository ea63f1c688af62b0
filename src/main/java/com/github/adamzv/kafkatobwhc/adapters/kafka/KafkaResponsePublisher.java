package com.github.adamzv.kafkatobwhc.adapters.kafka;

import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.domain.OutboundRecord;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import com.github.adamzv.kafkatobwhc.domain.Problems;
import com.github.adamzv.kafkatobwhc.domain.PublishResult;
import com.github.adamzv.kafkatobwhc.ports.ResponsePublisherPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.stereotype.Component;

@Component
public class KafkaResponsePublisher implements ResponsePublisherPort {

  public static final String STATUS_CODE_HEADER = "status_code";

  private static final Duration SEND_TIMEOUT = Duration.ofSeconds(10);

  private final Producer<byte[], byte[]> producer;
  private final BridgeConfig config;

  public KafkaResponsePublisher(Producer<byte[], byte[]> producer, BridgeConfig config) {
    this.producer = producer;
    this.config = config;
  }

  @Override
  public PublishResult publish(String topic, OutboundRecord response) {
    ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, response.key(), response.value());
    record.headers().add(new RecordHeader(
        STATUS_CODE_HEADER,
        Integer.toString(response.statusCode()).getBytes(StandardCharsets.US_ASCII)
    ));

    try {
      RecordMetadata metadata = producer.send(record).get(SEND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      return new PublishResult(metadata.topic(), metadata.partition(), metadata.offset());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while publishing response", Map.of("topic", topic), ex);
    } catch (TimeoutException ex) {
      throw Problems.kafkaUnavailable(
          "Timed out waiting for Kafka produce acknowledgement",
          Map.of("topic", topic, "bootstrapServers", config.bootstrapServers()),
          ex
      );
    } catch (ExecutionException ex) {
      throw translateSendFailure(topic, ex.getCause());
    } catch (KafkaException ex) {
      throw translateSendFailure(topic, ex);
    }
  }

  private ProblemException translateSendFailure(String topic, Throwable cause) {
    if (cause instanceof RecordTooLargeException) {
      return Problems.payloadTooLarge(
          "Kafka rejected response because it exceeds broker limits",
          Map.of("topic", topic)
      );
    }
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable(
          "Kafka produce failed",
          buildErrorDetails(topic, cause, true),
          cause
      );
    }
    return Problems.operationFailed(
        "Unexpected error during produce",
        buildErrorDetails(topic, cause, false),
        cause
    );
  }

  private Map<String, Object> buildErrorDetails(String topic, Throwable cause, boolean includeBootstrap) {
    Map<String, Object> details = new HashMap<>();
    details.put("topic", topic);
    if (includeBootstrap) {
      details.put("bootstrapServers", config.bootstrapServers());
    }
    if (cause != null) {
      details.put("error", cause.getClass().getSimpleName());
      if (cause.getMessage() != null) {
        details.put("message", cause.getMessage());
      }
    }
    return Collections.unmodifiableMap(details);
  }
}
