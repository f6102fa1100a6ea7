package com.novoflow.novoflow_backend.exception;

import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;

/** Non-2xx answer from an api_call node. Carries both envelopes so the log entry can show them. */
public class HttpCallException extends PipelineException {

    private final transient RequestEnvelope request;
    private final transient ResponseEnvelope response;

    public HttpCallException(String message, RequestEnvelope request, ResponseEnvelope response) {
        super(message);
        this.request = request;
        this.response = response;
    }

    public HttpCallException(String message, RequestEnvelope request, ResponseEnvelope response, Throwable cause) {
        super(message, cause);
        this.request = request;
        this.response = response;
    }

    public RequestEnvelope getRequest() {
        return request;
    }

    public ResponseEnvelope getResponse() {
        return response;
    }

    public int getStatus() {
        return response != null ? response.getStatus() : 0;
    }
}
