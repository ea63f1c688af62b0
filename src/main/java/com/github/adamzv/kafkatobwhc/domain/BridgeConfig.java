package com.github.adamzv.kafkatobwhc.domain;

import java.net.URI;
import java.time.Duration;

public record BridgeConfig(
    URI backendUri,
    Duration backendTimeout,
    String bootstrapServers,
    BridgeTopology topology
) {

  public String inboundTopic() {
    return topology.inboundTopic();
  }

  public String responseTopic() {
    return topology.responseTopic();
  }

  public String groupId() {
    return topology.groupId();
  }
}
