package com.github.adamzv.kafkatobwhc.domain;

public record OutboundRecord(
    byte[] key,
    byte[] value,
    int statusCode
) {}
