package com.mk.fx.qa.benchmark.execution.model;

public enum RunStatus {
  QUEUED,
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == CANCELLED;
  }
}
