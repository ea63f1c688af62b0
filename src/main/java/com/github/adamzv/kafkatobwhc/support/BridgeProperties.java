package com.github.adamzv.kafkatobwhc.support;

import com.github.adamzv.kafkatobwhc.application.TopicResolver;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record BridgeProperties(
    @Valid
    @NotNull(message = "app.rest.uri must be configured")
    Rest rest,
    @Valid
    @NotNull(message = "app.kafka.topic must be configured")
    Kafka kafka,
    @DefaultValue("30s")
    Duration shutdownTimeout
) {

  public BridgeConfig toBridgeConfig(KafkaProperties kafkaProperties) {
    return new BridgeConfig(
        rest.baseUri(),
        rest.timeout(),
        kafkaProperties.bootstrapServers(),
        TopicResolver.resolve(kafka.topic(), kafka.responseTopic(), kafka.groupId())
    );
  }

  @AssertTrue(message = "app.shutdownTimeout must be > 0")
  public boolean isShutdownTimeoutPositive() {
    return shutdownTimeout == null || (!shutdownTimeout.isNegative() && !shutdownTimeout.isZero());
  }

  public record Rest(
      @NotBlank(message = "app.rest.uri must not be blank")
      String uri,
      @DefaultValue("5s")
      Duration timeout
  ) {

    public URI baseUri() {
      String trimmed = uri.trim();
      while (trimmed.endsWith("/")) {
        trimmed = trimmed.substring(0, trimmed.length() - 1);
      }
      return URI.create(trimmed);
    }

    @AssertTrue(message = "app.rest.uri must be an absolute http or https URI")
    public boolean isUriValid() {
      if (uri == null || uri.isBlank()) {
        return true;
      }
      try {
        URI parsed = new URI(uri.trim());
        String scheme = parsed.getScheme();
        return parsed.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
      } catch (URISyntaxException ex) {
        return false;
      }
    }

    @AssertTrue(message = "app.rest.timeout must be > 0")
    public boolean isTimeoutPositive() {
      return timeout == null || (!timeout.isNegative() && !timeout.isZero());
    }
  }

  public record Kafka(
      @NotBlank(message = "app.kafka.topic must not be blank")
      String topic,
      String responseTopic,
      String groupId
  ) {}
}
