package com.novoflow.novoflow_backend.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldSchema {

    // "string" | "number" | "boolean"
    private String type;

    private boolean required;

    @JsonProperty("default")
    private Object defaultValue;

    private String label;

    private String helpText;
}
