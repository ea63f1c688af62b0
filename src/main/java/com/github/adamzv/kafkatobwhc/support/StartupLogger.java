package com.github.adamzv.kafkatobwhc.support;

import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Component
public class StartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(StartupLogger.class);

  private final BridgeConfig config;
  private final Environment environment;

  public StartupLogger(BridgeConfig config, Environment environment) {
    this.config = config;
    this.environment = environment;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info(
        "bridge_ready name={} backendUri={} timeoutMs={} bootstrapServers={} topics={{inbound={}, response={}, groupId={}}}",
        environment.getProperty("spring.application.name", "kafka-to-bwhc"),
        config.backendUri(),
        config.backendTimeout().toMillis(),
        config.bootstrapServers(),
        config.inboundTopic(),
        config.responseTopic(),
        config.groupId()
    );
  }
}
