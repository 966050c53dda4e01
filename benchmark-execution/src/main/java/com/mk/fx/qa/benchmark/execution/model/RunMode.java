package com.mk.fx.qa.benchmark.execution.model;

import java.util.Arrays;

/** Whether a run benchmarks one system or compares two. */
public enum RunMode {
  SINGLE(1),
  COMPARE(2);

  private final int requiredTargets;

  RunMode(int requiredTargets) {
    this.requiredTargets = requiredTargets;
  }

  public int requiredTargets() {
    return requiredTargets;
  }

  /**
   * Resolves a mode case-insensitively; {@code null} or blank means {@link #COMPARE}.
   *
   * @throws IllegalArgumentException for unknown modes
   */
  public static RunMode fromValue(String value) {
    if (value == null || value.isBlank()) {
      return COMPARE;
    }
    return Arrays.stream(values())
        .filter(mode -> mode.name().equalsIgnoreCase(value.trim()))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unsupported run mode: " + value + ". Allowed: " + Arrays.toString(values())));
  }
}
