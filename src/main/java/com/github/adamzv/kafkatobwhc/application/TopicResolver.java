package com.github.adamzv.kafkatobwhc.application;

import com.github.adamzv.kafkatobwhc.domain.BridgeTopology;

public final class TopicResolver {

  public static final String RESPONSE_TOPIC_SUFFIX = "_response";
  public static final String GROUP_ID_SUFFIX = "_group";

  private TopicResolver() {
  }

  public static BridgeTopology resolve(String inboundTopic, String responseTopic, String groupId) {
    if (inboundTopic == null || inboundTopic.isBlank()) {
      throw new IllegalArgumentException("Inbound topic must not be blank");
    }
    return new BridgeTopology(
        inboundTopic,
        isBlank(responseTopic) ? inboundTopic + RESPONSE_TOPIC_SUFFIX : responseTopic,
        isBlank(groupId) ? inboundTopic + GROUP_ID_SUFFIX : groupId
    );
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
