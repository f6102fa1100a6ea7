package com.novoflow.novoflow_backend.executor.http;

import java.util.Map;

/**
 * Per-call options for {@link ApiClient}. {@code method} overrides the verb implied by the
 * call (PUT/PATCH travel through {@code post}, DELETE through {@code get}).
 */
public record RequestConfig(Map<String, String> headers, String method) {

    public RequestConfig {
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static RequestConfig of(Map<String, String> headers) {
        return new RequestConfig(headers, null);
    }
}
