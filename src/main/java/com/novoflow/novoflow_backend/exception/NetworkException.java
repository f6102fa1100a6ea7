package com.novoflow.novoflow_backend.exception;

import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;

import java.util.Map;

/** The request never got an answer (connection refused, DNS, timeout). */
public class NetworkException extends HttpCallException {

    public NetworkException(String detail, RequestEnvelope request, Throwable cause) {
        super("Network Error: " + detail, request, ResponseEnvelope.builder()
                .status(0)
                .statusText("Network Error")
                .headers(Map.of())
                .data(Map.of("error", "Network Error: " + detail, "status", "error"))
                .build(), cause);
    }
}
