package com.novoflow.novoflow_backend.executor.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;

/**
 * Default {@link ApiClient}: a RestTemplate whose root URI is novoflow.api.base-url.
 */
@Slf4j
@RequiredArgsConstructor
public class RestTemplateApiClient implements ApiClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public ResponseEnvelope get(String url, RequestConfig config) {
        return exchange(url, verb(config, HttpMethod.GET), null, config);
    }

    @Override
    public ResponseEnvelope post(String url, Object body, RequestConfig config) {
        return exchange(url, verb(config, HttpMethod.POST), body, config);
    }

    private ResponseEnvelope exchange(String url, HttpMethod method, Object body, RequestConfig config) {
        HttpHeaders headers = new HttpHeaders();
        if (config != null) config.headers().forEach(headers::set);
        if (body != null && !(body instanceof String) && headers.getContentType() == null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        log.debug("API call {} {}", method, url);
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            return ResponseEnvelopes.of(response.getStatusCode(), response.getHeaders(), response.getBody(), objectMapper);
        } catch (HttpStatusCodeException ex) {
            return ResponseEnvelopes.of(ex.getStatusCode(), ex.getResponseHeaders(), ex.getResponseBodyAsString(), objectMapper);
        }
    }

    private HttpMethod verb(RequestConfig config, HttpMethod fallback) {
        if (config == null || config.method() == null || config.method().isBlank()) return fallback;
        return HttpMethod.valueOf(config.method().toUpperCase(Locale.ROOT));
    }
}
