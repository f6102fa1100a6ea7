package com.novoflow.novoflow_backend.executor.http;

import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;

/**
 * HTTP collaborator for relative (application-internal) endpoints.
 * Implementations return the envelope for every HTTP answer, 2xx or not, and throw
 * {@link org.springframework.web.client.RestClientException} only when no answer arrived.
 */
public interface ApiClient {

    ResponseEnvelope get(String url, RequestConfig config);

    ResponseEnvelope post(String url, Object body, RequestConfig config);
}
