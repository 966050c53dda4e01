package com.mk.fx.qa.benchmark.execution.model;

/** A system under test: the label used in reports and the base URL traffic is sent to. */
public record BenchmarkTarget(String label, String baseUrl) {}
