package com.mk.fx.qa.benchmark.execution.model;

/**
 * Users, duration and ramp-up applied to every scenario of a run. Values left {@code null} at
 * submission are filled from the configured defaults by {@link #withDefaults}.
 */
public record LoadProfile(Integer users, Integer durationSeconds, Integer rampUpSeconds) {

  public LoadProfile withDefaults(int defaultUsers, int defaultDurationSeconds, int defaultRampUp) {
    return new LoadProfile(
        users != null ? users : defaultUsers,
        durationSeconds != null ? durationSeconds : defaultDurationSeconds,
        rampUpSeconds != null ? rampUpSeconds : defaultRampUp);
  }

  public boolean isComplete() {
    return users != null && durationSeconds != null && rampUpSeconds != null;
  }
}
