package com.github.adamzv.kafkatobwhc.support;

import com.github.adamzv.kafkatobwhc.adapters.kafka.BridgeFaultHandler;
import com.github.adamzv.kafkatobwhc.adapters.kafka.BridgeLoop;
import com.github.adamzv.kafkatobwhc.application.ForwardRecordUseCase;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import java.net.http.HttpClient;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({KafkaProperties.class, BridgeProperties.class})
public class ApplicationConfig {

  private static final String CLIENT_ID_PREFIX = "kafka-to-bwhc-";

  // keeps a full batch well inside max.poll.interval.ms with one blocking call per record
  private static final int MAX_POLL_RECORDS = 10;

  @Bean
  public BridgeConfig bridgeConfig(BridgeProperties bridgeProperties, KafkaProperties kafkaProperties) {
    return bridgeProperties.toBridgeConfig(kafkaProperties);
  }

  @Bean
  public RestClient bwhcRestClient(BridgeConfig config) {
    HttpClient httpClient = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(config.backendTimeout())
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(config.backendTimeout());
    return RestClient.builder()
        .baseUrl(config.backendUri().toString())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean(destroyMethod = "close")
  public Producer<byte[], byte[]> kafkaProducer(BridgeConfig config) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
    props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID_PREFIX + config.responseTopic());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  // closed by BridgeLoop on its own thread
  @Bean(destroyMethod = "")
  public Consumer<byte[], byte[]> kafkaConsumer(BridgeConfig config, KafkaProperties kafkaProperties) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, config.groupId());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, CLIENT_ID_PREFIX + config.groupId());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, kafkaProperties.autoOffsetReset());
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, MAX_POLL_RECORDS);
    return new KafkaConsumer<>(props);
  }

  @Bean
  public BridgeLoop bridgeLoop(
      Consumer<byte[], byte[]> kafkaConsumer,
      ForwardRecordUseCase forwardRecordUseCase,
      BridgeConfig config,
      BridgeFaultHandler bridgeFaultHandler) {
    return new BridgeLoop(kafkaConsumer, forwardRecordUseCase, config, bridgeFaultHandler);
  }
}
