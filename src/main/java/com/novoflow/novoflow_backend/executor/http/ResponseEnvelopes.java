package com.novoflow.novoflow_backend.executor.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.util.LinkedHashMap;
import java.util.Map;

/** Builds {@link ResponseEnvelope}s from raw Spring HTTP responses. */
public final class ResponseEnvelopes {

    private ResponseEnvelopes() {}

    public static ResponseEnvelope of(HttpStatusCode status, HttpHeaders headers, String body, ObjectMapper objectMapper) {
        return ResponseEnvelope.builder()
                .status(status.value())
                .statusText(statusText(status))
                .headers(flatten(headers))
                .data(parseBody(body, objectMapper))
                .build();
    }

    public static String statusText(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "";
    }

    public static Map<String, String> flatten(HttpHeaders headers) {
        Map<String, String> flat = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, values) -> flat.put(name.toLowerCase(), String.join(", ", values)));
        }
        return flat;
    }

    /** JSON when it parses as JSON, whatever the Content-Type says; plain text otherwise. */
    public static Object parseBody(String body, ObjectMapper objectMapper) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (Exception e) {
            return body;
        }
    }
}
