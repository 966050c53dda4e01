package com.mk.fx.qa.benchmark.execution.selector;

import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import java.util.List;
import java.util.Objects;

/**
 * Picks an endpoint with probability proportional to its weight. Every call is independent of the
 * previous ones. Safe for concurrent use as long as the random source is.
 */
public class WeightedEndpointSelector {

  private final RandomSource randomSource;

  public WeightedEndpointSelector() {
    this(RandomSource.threadLocal());
  }

  public WeightedEndpointSelector(RandomSource randomSource) {
    this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
  }

  /**
   * Selects one endpoint.
   *
   * @param endpoints non-empty weighted endpoint list
   * @return the selected endpoint; the last one if rounding leaves no match
   * @throws IllegalArgumentException if the list is empty, or holds several endpoints whose total
   *     weight is not positive
   */
  public EndpointDefinition select(List<EndpointDefinition> endpoints) {
    if (endpoints == null || endpoints.isEmpty()) {
      throw new IllegalArgumentException("Cannot select from an empty endpoint list");
    }
    if (endpoints.size() == 1) {
      return endpoints.get(0);
    }

    double total = 0;
    for (EndpointDefinition endpoint : endpoints) {
      total += endpoint.weight();
    }
    if (!(total > 0)) {
      throw new IllegalArgumentException("Total endpoint weight must be positive but was " + total);
    }

    double remaining = randomSource.nextDouble() * total;
    for (EndpointDefinition endpoint : endpoints) {
      remaining -= endpoint.weight();
      if (remaining <= 0) {
        return endpoint;
      }
    }
    return endpoints.get(endpoints.size() - 1);
  }
}
