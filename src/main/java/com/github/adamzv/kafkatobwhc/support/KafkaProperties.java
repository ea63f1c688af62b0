package com.github.adamzv.kafkatobwhc.support;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "kafka")
public record KafkaProperties(
    @NotBlank(message = "kafka.bootstrapServers must not be blank")
    String bootstrapServers,
    @DefaultValue("earliest")
    @Pattern(regexp = "earliest|latest|none", message = "kafka.autoOffsetReset must be earliest, latest or none")
    String autoOffsetReset
) {}
