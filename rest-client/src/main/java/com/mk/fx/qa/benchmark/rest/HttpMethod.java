package com.mk.fx.qa.benchmark.rest;

import java.util.Arrays;

/** HTTP methods a benchmark endpoint may use. */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE;

    /**
     * Resolves a method name case-insensitively. Unknown, blank or {@code null} names resolve to
     * {@link #GET}.
     *
     * @param value the method name as configured on the endpoint
     * @return the matching method, or {@code GET}
     */
    public static HttpMethod resolve(String value) {
        if (value == null || value.isBlank()) {
            return GET;
        }
        return Arrays.stream(values())
                .filter(method -> method.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(GET);
    }
}
