package com.novoflow.novoflow_backend.model.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResponseEnvelope {
    private int status;
    private String statusText;
    private Map<String, String> headers;
    private Object data;

    @JsonIgnore
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
