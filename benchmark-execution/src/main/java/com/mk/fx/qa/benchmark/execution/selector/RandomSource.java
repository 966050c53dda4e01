package com.mk.fx.qa.benchmark.execution.selector;

import java.util.concurrent.ThreadLocalRandom;

/** Source of uniformly distributed doubles in {@code [0, 1)}. */
@FunctionalInterface
public interface RandomSource {

  double nextDouble();

  /** Thread-safe source backed by {@link ThreadLocalRandom}. */
  static RandomSource threadLocal() {
    return () -> ThreadLocalRandom.current().nextDouble();
  }
}
