package com.github.adamzv.kafkatobwhc.support;

import com.github.adamzv.kafkatobwhc.adapters.kafka.BridgeLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the bridge loop on a dedicated thread once the context is up and waits for the
 * record in flight on shutdown.
 */
@Component
public class BridgeRunner implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(BridgeRunner.class);

  private final BridgeLoop bridgeLoop;
  private final BridgeProperties bridgeProperties;
  private volatile Thread thread;

  public BridgeRunner(BridgeLoop bridgeLoop, BridgeProperties bridgeProperties) {
    this.bridgeLoop = bridgeLoop;
    this.bridgeProperties = bridgeProperties;
  }

  @Override
  public synchronized void start() {
    if (thread != null) {
      return;
    }
    thread = new Thread(bridgeLoop, "bridge-loop");
    thread.start();
  }

  @Override
  public void stop() {
    bridgeLoop.stop();
    try {
      if (!bridgeLoop.awaitTermination(bridgeProperties.shutdownTimeout())) {
        log.warn("bridge_shutdown_timeout timeoutMs={}", bridgeProperties.shutdownTimeout().toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("bridge_shutdown_interrupted");
    }
  }

  @Override
  public boolean isRunning() {
    return thread != null && !bridgeLoop.isTerminated();
  }
}
