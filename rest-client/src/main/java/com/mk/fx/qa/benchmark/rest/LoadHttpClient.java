package com.mk.fx.qa.benchmark.rest;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * HTTP client shared by every virtual user of a benchmark. Wraps a single {@link HttpClient}
 * (and therefore a single connection pool) that is never mutated after construction, so one
 * instance can be used concurrently from any number of threads.
 *
 * <p>Only response metadata is observed: the completion timestamp is taken as soon as the status
 * line and headers arrive, after which the body is drained and discarded so the connection goes
 * back to the pool. This implementation does not include retry logic.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

    /** Default request timeout in seconds. */
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    /** Default connection timeout in seconds. */
    public static final int DEFAULT_CONNECTION_TIMEOUT_SECONDS = 5;

    /** The underlying Java HTTP client. */
    private final HttpClient httpClient;

    /** Global headers to be included in all requests. */
    private final Map<String, String> headers;

    /** Timeout duration for requests. */
    private final Duration requestTimeout;

    /**
     * Constructs a LoadHttpClient with default connection and request timeouts and no global
     * headers.
     */
    public LoadHttpClient() {
        this(DEFAULT_CONNECTION_TIMEOUT_SECONDS, DEFAULT_REQUEST_TIMEOUT_SECONDS, Map.of());
    }

    /**
     * Constructs a LoadHttpClient with a specified request timeout.
     *
     * @param connTimeOutSeconds connection timeout in seconds
     * @param requestTimeoutSeconds request timeout in seconds
     * @param headers global headers to include in all requests
     */
    public LoadHttpClient(int connTimeOutSeconds, int requestTimeoutSeconds, Map<String, String> headers) {
        if (connTimeOutSeconds <= 0 || requestTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);

        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(connTimeOutSeconds))
                .build();

        this.headers = headers != null ? Map.copyOf(headers) : Map.of();

        log.info(
                "LoadHttpClient initialised - Connection timeout: {}s, Request timeout: {}s, Global headers: {}",
                connTimeOutSeconds,
                requestTimeoutSeconds,
                this.headers.keySet());
    }

    /**
     * Executes a synchronous request against {@code baseUrl + request.path}.
     *
     * @param baseUrl the base URL of the target system
     * @param request the request to execute
     * @return the response metadata together with the dispatch and completion timestamps
     * @throws HttpTransportException if no response could be obtained
     * @throws IllegalArgumentException if the request cannot be built (bad URL, restricted header)
     */
    public RestResponseData execute(String baseUrl, Request request) {
        Objects.requireNonNull(request, "Request cannot be null");

        var httpRequest = buildHttpRequest(baseUrl, request);
        log.trace("Executing {} request to {}", httpRequest.method(), httpRequest.uri());

        var startTime = System.nanoTime();
        try {
            HttpResponse<InputStream> response =
                    httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofInputStream());
            var endTime = System.nanoTime();
            discardBody(response);
            return buildResponseData(response, startTime, endTime);

        } catch (HttpTimeoutException e) {
            var endTime = System.nanoTime();
            log.debug("Request to {} timed out after {} seconds", httpRequest.uri(), requestTimeout.getSeconds());
            throw new HttpTransportException(
                    "Request timed out after " + requestTimeout.getSeconds() + "s: " + e.getMessage(),
                    e,
                    startTime,
                    endTime);
        } catch (IOException e) {
            var endTime = System.nanoTime();
            log.debug("Error executing request to {}: {}", httpRequest.uri(), e.toString());
            throw new HttpTransportException("Error executing request: " + e.getMessage(), e, startTime, endTime);
        } catch (InterruptedException e) {
            var endTime = System.nanoTime();
            Thread.currentThread().interrupt();
            throw new HttpTransportException("Request interrupted", e, startTime, endTime);
        }
    }

    /**
     * Builds an HTTP request for the given base URL and request definition. The body, when
     * present, is attached whatever the method, GET included.
     *
     * @param baseUrl the base URL of the target system
     * @param request the request to build
     * @return the constructed HttpRequest
     * @throws IllegalArgumentException if an error occurs while building the request
     */
    private HttpRequest buildHttpRequest(String baseUrl, Request request) {
        try {
            var url = normalizeBaseUrl(baseUrl) + (request.getPath() != null ? request.getPath() : "");
            var method = request.getMethod() != null ? request.getMethod() : HttpMethod.GET;

            var requestBuilder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout);

            // global headers
            headers.forEach(requestBuilder::header);

            // request-specific headers override
            if (request.getHeaders() != null) {
                request.getHeaders().forEach(requestBuilder::setHeader);
            }

            if (request.getBody() != null) {
                requestBuilder.method(method.name(), HttpRequest.BodyPublishers.ofString(request.getBody()));
            } else {
                requestBuilder.method(method.name(), HttpRequest.BodyPublishers.noBody());
            }

            return requestBuilder.build();

        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Error building HTTP request: " + e.getMessage(), e);
        }
    }

    /**
     * Builds a RestResponseData object from the HTTP response.
     *
     * @param response the HTTP response
     * @param startNanos monotonic time just before dispatch
     * @param endNanos monotonic time just after the response headers were received
     * @return the constructed RestResponseData
     */
    private RestResponseData buildResponseData(HttpResponse<?> response, long startNanos, long endNanos) {
        var result = new RestResponseData();
        result.setStatusCode(response.statusCode());
        result.setHeaders(
                response.headers().map().entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> String.join(",", e.getValue()))));
        result.setContentLength(contentLength(response));
        result.setStartNanos(startNanos);
        result.setEndNanos(endNanos);
        return result;
    }

    /**
     * Reads the declared {@code Content-Length}, or 0 when absent or malformed.
     *
     * @param response the HTTP response
     * @return the declared body size in bytes
     */
    private long contentLength(HttpResponse<?> response) {
        try {
            return Math.max(0, response.headers().firstValueAsLong("Content-Length").orElse(0));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Reads the remaining body into a null sink. Closing an unread body makes the JDK client drop
     * the connection instead of reusing it.
     */
    private void discardBody(HttpResponse<InputStream> response) {
        try (var body = response.body()) {
            body.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            log.debug("Failed to release response body: {}", e.getMessage());
        }
    }

    /**
     * Validates and normalizes the base URL.
     *
     * @param baseUrl the base URL to validate
     * @return the base URL without surrounding whitespace or a trailing slash
     * @throws IllegalArgumentException if the base URL is null or empty
     */
    public static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null) {
            throw new IllegalArgumentException("Base URL cannot be null");
        }
        var trimmed = baseUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    @Override
    public void close() {
        log.debug("LoadHttpClient closed");
    }
}
