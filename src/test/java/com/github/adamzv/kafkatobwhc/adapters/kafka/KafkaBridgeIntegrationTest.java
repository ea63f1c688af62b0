package com.github.adamzv.kafkatobwhc.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkatobwhc.adapters.http.BwhcBackendAdapter;
import com.github.adamzv.kafkatobwhc.application.ForwardRecordUseCase;
import com.github.adamzv.kafkatobwhc.application.ResponseEnvelopeBuilder;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import com.github.adamzv.kafkatobwhc.support.ApplicationConfig;
import com.github.adamzv.kafkatobwhc.support.BridgeProperties;
import com.github.adamzv.kafkatobwhc.support.KafkaProperties;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
class KafkaBridgeIntegrationTest {

  private static final DockerImageName KAFKA_IMAGE = DockerImageName.parse("confluentinc/cp-kafka:7.5.0");

  @Container
  static final KafkaContainer KAFKA = new KafkaContainer(KAFKA_IMAGE)
      .withReuse(false);

  private static HttpServer backend;
  private static AdminClient adminClient;

  @BeforeAll
  static void setUp() throws Exception {
    backend = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    backend.createContext("/bwhc/etl/api/MTBFile", exchange -> {
      byte[] body = "{\"status\":\"ok\"}".getBytes(StandardCharsets.UTF_8);
      exchange.getRequestBody().readAllBytes();
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    backend.start();

    Properties props = new Properties();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    adminClient = AdminClient.create(props);
  }

  @AfterAll
  static void tearDown() {
    if (adminClient != null) {
      adminClient.close(Duration.ofSeconds(1));
    }
    if (backend != null) {
      backend.stop(0);
    }
  }

  @Test
  void forwardsRecordsAndPublishesResponsesUnderSameKey() throws Exception {
    adminClient.createTopics(List.of(
            new NewTopic("requests", 1, (short) 1),
            new NewTopic("requests_response", 1, (short) 1)))
        .all()
        .get(10, TimeUnit.SECONDS);

    BridgeProperties bridgeProperties = new BridgeProperties(
        new BridgeProperties.Rest("http://127.0.0.1:" + backend.getAddress().getPort() + "/bwhc/etl/api", Duration.ofSeconds(2)),
        new BridgeProperties.Kafka("requests", null, null),
        Duration.ofSeconds(10)
    );
    KafkaProperties kafkaProperties = new KafkaProperties(KAFKA.getBootstrapServers(), "earliest");
    ApplicationConfig applicationConfig = new ApplicationConfig();
    BridgeConfig config = applicationConfig.bridgeConfig(bridgeProperties, kafkaProperties);

    ObjectMapper objectMapper = new ObjectMapper();
    Producer<byte[], byte[]> producer = applicationConfig.kafkaProducer(config);
    ForwardRecordUseCase useCase = new ForwardRecordUseCase(
        new BwhcBackendAdapter(applicationConfig.bwhcRestClient(config), config),
        new KafkaResponsePublisher(producer, config),
        new ResponseEnvelopeBuilder(objectMapper),
        objectMapper,
        config,
        new SimpleMeterRegistry()
    );
    List<ProblemException> faults = new CopyOnWriteArrayList<>();
    BridgeLoop loop = new BridgeLoop(
        applicationConfig.kafkaConsumer(config, kafkaProperties),
        useCase,
        config,
        faults::add
    );

    producer.send(new ProducerRecord<>("requests", bytes("case-1"), bytes("<mtb-file-xml>"))).get(10, TimeUnit.SECONDS);
    producer.send(new ProducerRecord<>("requests", null, bytes("{}"))).get(10, TimeUnit.SECONDS);

    Thread thread = new Thread(loop, "bridge-loop-test");
    thread.start();

    Map<String, String> responses = new HashMap<>();
    List<String> keys = new ArrayList<>();
    try (Consumer<String, String> responseConsumer = responseConsumer()) {
      responseConsumer.subscribe(List.of("requests_response"));
      long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
      while (responses.size() < 2 && System.nanoTime() < deadline) {
        for (ConsumerRecord<String, String> record : responseConsumer.poll(Duration.ofMillis(500))) {
          String key = record.key() == null ? "<none>" : record.key();
          keys.add(key);
          responses.put(key, record.value());
        }
      }
    } finally {
      loop.stop();
      assertTrue(loop.awaitTermination(Duration.ofSeconds(10)));
      producer.close(Duration.ofSeconds(1));
    }

    assertEquals(List.of("case-1", "<none>"), keys);
    assertEquals("{\"status\":\"ok\"}", responses.get("case-1"));
    assertTrue(faults.isEmpty());
  }

  private static Consumer<String, String> responseConsumer() {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, "response-reader");
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
    return new KafkaConsumer<>(props);
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
