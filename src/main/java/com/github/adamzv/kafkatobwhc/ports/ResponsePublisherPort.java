package com.github.adamzv.kafkatobwhc.ports;

import com.github.adamzv.kafkatobwhc.domain.OutboundRecord;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import com.github.adamzv.kafkatobwhc.domain.PublishResult;

public interface ResponsePublisherPort {

  PublishResult publish(String topic, OutboundRecord record) throws ProblemException;
}
