package com.github.adamzv.kafkatobwhc.ports;

import com.github.adamzv.kafkatobwhc.domain.BackendOutcome;

public interface BackendPort {

  BackendOutcome forward(byte[] payload);

  BackendOutcome delete(String patientId);
}
