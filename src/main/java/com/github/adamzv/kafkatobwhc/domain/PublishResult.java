package com.github.adamzv.kafkatobwhc.domain;

public record PublishResult(
    String topic,
    int partition,
    long offset
) {}
