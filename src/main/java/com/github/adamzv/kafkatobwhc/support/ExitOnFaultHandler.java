package com.github.adamzv.kafkatobwhc.support;

import com.github.adamzv.kafkatobwhc.adapters.kafka.BridgeFaultHandler;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class ExitOnFaultHandler implements BridgeFaultHandler {

  static final int FAULT_EXIT_CODE = 1;

  private static final Logger log = LoggerFactory.getLogger(ExitOnFaultHandler.class);

  private final Runnable exitAction;

  @Autowired
  public ExitOnFaultHandler(ApplicationContext context) {
    this(() -> System.exit(SpringApplication.exit(context, () -> FAULT_EXIT_CODE)));
  }

  ExitOnFaultHandler(Runnable exitAction) {
    this.exitAction = exitAction;
  }

  @Override
  public void onFault(ProblemException fault) {
    log.error("bridge_exit code={} exitCode={}", fault.problem().code(), FAULT_EXIT_CODE);
    // the context close waits on the loop thread, so exit from a separate one
    Thread exit = new Thread(exitAction, "bridge-exit");
    exit.start();
  }
}
