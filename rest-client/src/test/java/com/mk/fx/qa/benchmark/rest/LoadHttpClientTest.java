package com.mk.fx.qa.benchmark.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoadHttpClientTest {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> lastMethod = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastHeader = new AtomicReference<>();
  private final AtomicReference<String> lastGlobalHeader = new AtomicReference<>();
  private final Set<Integer> clientPorts = ConcurrentHashMap.newKeySet();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext(
        "/echo",
        exchange -> {
          lastMethod.set(exchange.getRequestMethod());
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          lastHeader.set(exchange.getRequestHeaders().getFirst("X-Test"));
          lastGlobalHeader.set(exchange.getRequestHeaders().getFirst("X-Global"));
          byte[] body = "hello world".getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(201, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.createContext(
        "/chunked",
        exchange -> {
          exchange.sendResponseHeaders(200, 0);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write("streamed".getBytes(StandardCharsets.UTF_8));
          }
        });
    server.createContext(
        "/ports",
        exchange -> {
          clientPorts.add(exchange.getRemoteAddress().getPort());
          byte[] body = "ok".repeat(512).getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(200, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private static Request request(HttpMethod method, String path, String body) {
    var request = new Request();
    request.setMethod(method);
    request.setPath(path);
    request.setHeaders(Map.of("X-Test", "yes"));
    request.setBody(body);
    return request;
  }

  @Test
  void execute_returnsStatusDeclaredLengthAndTimings() {
    var client = new LoadHttpClient(5, 5, Map.of("X-Global", "g"));

    var response = client.execute(baseUrl + "/", request(HttpMethod.POST, "/echo", "{\"a\":1}"));

    assertThat(response.getStatusCode()).isEqualTo(201);
    assertThat(response.getContentLength()).isEqualTo(11);
    assertThat(response.getEndNanos()).isGreaterThanOrEqualTo(response.getStartNanos());
    assertThat(lastMethod.get()).isEqualTo("POST");
    assertThat(lastBody.get()).isEqualTo("{\"a\":1}");
    assertThat(lastHeader.get()).isEqualTo("yes");
    assertThat(lastGlobalHeader.get()).isEqualTo("g");
  }

  @Test
  void execute_sequentialRequestsReuseOneConnection() {
    var client = new LoadHttpClient(5, 5, Map.of());

    for (int i = 0; i < 50; i++) {
      var response = client.execute(baseUrl, request(HttpMethod.GET, "/ports", null));
      assertThat(response.getStatusCode()).isEqualTo(200);
      assertThat(response.getContentLength()).isEqualTo(1024);
    }

    assertThat(clientPorts).hasSize(1);
  }

  @Test
  void execute_sendsBodyEvenForGet() {
    var client = new LoadHttpClient();

    client.execute(baseUrl, request(HttpMethod.GET, "/echo", "payload"));

    assertThat(lastMethod.get()).isEqualTo("GET");
    assertThat(lastBody.get()).isEqualTo("payload");
  }

  @Test
  void execute_reportsZeroLengthWhenContentLengthMissing() {
    var client = new LoadHttpClient();

    var response = client.execute(baseUrl, request(HttpMethod.GET, "/chunked", null));

    assertThat(response.getStatusCode()).isEqualTo(200);
    assertThat(response.getContentLength()).isZero();
  }

  @Test
  void execute_wrapsConnectionFailureWithTimings() {
    var client = new LoadHttpClient(1, 1, Map.of());

    assertThatThrownBy(
            () -> client.execute("http://127.0.0.1:1", request(HttpMethod.GET, "/x", null)))
        .isInstanceOfSatisfying(
            HttpTransportException.class,
            ex -> {
              assertThat(ex.getCause()).isNotNull();
              assertThat(ex.getEndNanos()).isGreaterThanOrEqualTo(ex.getStartNanos());
            });
  }

  @Test
  void execute_rejectsRestrictedHeaderAsIllegalArgument() {
    var client = new LoadHttpClient();
    var request = request(HttpMethod.GET, "/echo", null);
    request.setHeaders(Map.of("Connection", "close"));

    assertThatThrownBy(() -> client.execute(baseUrl, request))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Error building HTTP request");
  }

  @Test
  void resolve_fallsBackToGetForUnknownMethods() {
    assertThat(HttpMethod.resolve("post")).isEqualTo(HttpMethod.POST);
    assertThat(HttpMethod.resolve(" Delete ")).isEqualTo(HttpMethod.DELETE);
    assertThat(HttpMethod.resolve("PATCH")).isEqualTo(HttpMethod.GET);
    assertThat(HttpMethod.resolve(null)).isEqualTo(HttpMethod.GET);
  }

  @Test
  void normalizeBaseUrl_trimsTrailingSlashAndRejectsBlank() {
    assertThat(LoadHttpClient.normalizeBaseUrl(" http://host:80/ ")).isEqualTo("http://host:80");
    assertThatThrownBy(() -> LoadHttpClient.normalizeBaseUrl("  "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_rejectsNonPositiveTimeouts() {
    assertThatThrownBy(() -> new LoadHttpClient(0, 30, Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
