package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * What a node sent (or, for non-HTTP strategies, what it acted on).
 * HTTP calls fill method/url/headers/queryParams/body; the other strategies fill type plus their own field.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestEnvelope {
    private String type;
    private String method;
    private String url;
    private Map<String, String> headers;
    private Map<String, Object> queryParams;
    private Object body;

    private String filename;
    private String message;
    private String code;
}
