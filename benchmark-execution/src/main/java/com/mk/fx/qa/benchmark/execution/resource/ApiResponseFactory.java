package com.mk.fx.qa.benchmark.execution.resource;

import com.mk.fx.qa.benchmark.execution.cfg.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class ApiResponseFactory {

  public ResponseEntity<ErrorResponse> error(HttpStatus status, String title, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(title, message));
  }

  public ResponseEntity<ErrorResponse> notFound(String message) {
    return error(HttpStatus.NOT_FOUND, "Not Found", message);
  }

  public <T> ResponseEntity<T> accepted(T body) {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
  }

  public <T> ResponseEntity<T> unavailable(T body) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  /** Wraps a rendered document with its media type, UTF-8 encoded. */
  public ResponseEntity<String> document(String body, String mediaType) {
    var type = MediaType.parseMediaType(mediaType + ";charset=UTF-8");
    return ResponseEntity.ok().contentType(type).body(body);
  }
}
