package com.github.adamzv.kafkatobwhc.adapters.kafka;

import com.github.adamzv.kafkatobwhc.domain.ProblemException;

/**
 * Called once, from the loop thread, after the bridge loop stopped because of a broker or
 * publish failure. The consumer is already closed at that point.
 */
@FunctionalInterface
public interface BridgeFaultHandler {

  void onFault(ProblemException fault);
}
