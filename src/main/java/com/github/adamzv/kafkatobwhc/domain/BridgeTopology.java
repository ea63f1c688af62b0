package com.github.adamzv.kafkatobwhc.domain;

public record BridgeTopology(
    String inboundTopic,
    String responseTopic,
    String groupId
) {}
