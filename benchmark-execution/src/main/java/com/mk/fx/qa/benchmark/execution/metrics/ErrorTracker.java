package com.mk.fx.qa.benchmark.execution.metrics;

import java.util.Map;
import java.util.TreeMap;

/**
 * Counts failed samples by HTTP status ({@code HTTP_<code>}, transport failures under {@code
 * HTTP_0}) and, for transport failures, by classified cause. Owned by a single aggregate and never
 * shared between threads.
 */
public final class ErrorTracker {

  private long totalErrors;
  private final Map<String, Long> statusBreakdown = new TreeMap<>();
  private final Map<String, Long> transportBreakdown = new TreeMap<>();

  void recordFailure(RequestSample sample) {
    totalErrors++;
    statusBreakdown.merge("HTTP_" + sample.statusCode(), 1L, Long::sum);
    if (sample.statusCode() == 0) {
      var reason = sample.failureReason();
      var key = reason == null || reason.isBlank() ? "UNKNOWN" : reason.toUpperCase();
      transportBreakdown.merge(key, 1L, Long::sum);
    }
  }

  long totalErrors() {
    return totalErrors;
  }

  Map<String, Long> statusSnapshot() {
    return Map.copyOf(statusBreakdown);
  }

  Map<String, Long> transportSnapshot() {
    return Map.copyOf(transportBreakdown);
  }

  /**
   * Maps a transport exception to a stable category by inspecting its root cause.
   *
   * @param t the failure raised while waiting for a response
   * @return category such as {@code CONNECTION_REFUSED} or the root cause's simple class name
   */
  public static String classify(Throwable t) {
    if (t == null) return "UNKNOWN";
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    var clsName = rootCause.getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException", "ClosedChannelException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException", "UnresolvedAddressException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      case "InterruptedException" -> "INTERRUPTED";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }
}
