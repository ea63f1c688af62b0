package com.github.adamzv.kafkatobwhc.domain;

public record InboundRecord(
    byte[] key,
    byte[] value,
    String topic,
    int partition,
    long offset
) {}
