package com.mk.fx.qa.benchmark.rest;

import java.util.Map;
import lombok.Data;

@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private String body;
}
