package com.github.adamzv.kafkatobwhc.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkatobwhc.adapters.kafka.BridgeLoop;
import com.github.adamzv.kafkatobwhc.application.ForwardRecordUseCase;
import com.github.adamzv.kafkatobwhc.application.ResponseEnvelopeBuilder;
import com.github.adamzv.kafkatobwhc.application.TopicResolver;
import com.github.adamzv.kafkatobwhc.domain.BackendOutcome;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.domain.PublishResult;
import com.github.adamzv.kafkatobwhc.ports.BackendPort;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.Test;

class ExitOnFaultHandlerTest {

  @Test
  void exitsFromSeparateThreadWhenLoopFaults() throws Exception {
    BridgeConfig config = new BridgeConfig(
        URI.create("http://bwhc.test"),
        Duration.ofSeconds(1),
        "localhost:9092",
        TopicResolver.resolve("requests", null, null)
    );
    MockConsumer<byte[], byte[]> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    consumer.setPollException(new KafkaException("broker down"));
    BackendPort backendPort = new BackendPort() {
      @Override
      public BackendOutcome forward(byte[] payload) {
        return new BackendOutcome.Success(200, new byte[0]);
      }

      @Override
      public BackendOutcome delete(String patientId) {
        return new BackendOutcome.Success(200, new byte[0]);
      }
    };
    ObjectMapper objectMapper = new ObjectMapper();
    ForwardRecordUseCase useCase = new ForwardRecordUseCase(
        backendPort,
        (topic, record) -> new PublishResult(topic, 0, 0L),
        new ResponseEnvelopeBuilder(objectMapper),
        objectMapper,
        config,
        new SimpleMeterRegistry()
    );
    CountDownLatch exited = new CountDownLatch(1);
    AtomicReference<String> exitThread = new AtomicReference<>();
    ExitOnFaultHandler handler = new ExitOnFaultHandler(() -> {
      exitThread.set(Thread.currentThread().getName());
      exited.countDown();
    });
    BridgeLoop loop = new BridgeLoop(consumer, useCase, config, handler);

    loop.run();

    assertTrue(exited.await(5, TimeUnit.SECONDS));
    assertEquals("bridge-exit", exitThread.get());
    assertTrue(loop.isTerminated());
    assertTrue(consumer.closed());
  }
}
