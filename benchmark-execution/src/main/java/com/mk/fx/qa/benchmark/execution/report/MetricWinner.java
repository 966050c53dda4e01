package com.mk.fx.qa.benchmark.execution.report;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Winner of one compared metric.
 *
 * @param metric the metric
 * @param winner label of the better system
 * @param loser label of the other system
 * @param winnerValue mean value of the winner
 * @param loserValue mean value of the loser
 * @param differencePercent {@code |winner - loser| / loser * 100}, or 0 when the loser's value is 0
 */
public record MetricWinner(
    @JsonProperty("metric") ComparedMetric metric,
    @JsonProperty("winner") String winner,
    @JsonProperty("loser") String loser,
    @JsonProperty("winner_value") double winnerValue,
    @JsonProperty("loser_value") double loserValue,
    @JsonProperty("difference_percent") double differencePercent) {}
