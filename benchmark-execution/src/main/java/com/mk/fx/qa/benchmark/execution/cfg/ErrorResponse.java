package com.mk.fx.qa.benchmark.execution.cfg;

/**
 * Body returned by the benchmark API whenever a request is rejected or fails.
 *
 * @param error short category, e.g. "Validation Failed" or "Conflict"
 * @param details what was wrong with the request or run
 */
public record ErrorResponse(String error, String details) {}
