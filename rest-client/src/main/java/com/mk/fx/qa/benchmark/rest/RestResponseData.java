package com.mk.fx.qa.benchmark.rest;

import java.util.Map;
import lombok.Data;

/** Metadata of a completed HTTP exchange. The response body is never buffered. */
@Data
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private long contentLength;
  private long startNanos;
  private long endNanos;

  public long getResponseTimeMs() {
    return (endNanos - startNanos) / 1_000_000;
  }
}
