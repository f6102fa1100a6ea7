package com.novoflow.novoflow_backend.model.definition.spec;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CodeExecutionSpec extends ExecutionSpec {

    public static final String TYPE = "code_execution";

    private String code;

    private String language = "javascript";

    // Overrides novoflow.script.timeout-ms for this node type
    private Long timeoutMs;

    public CodeExecutionSpec() {
        setType(TYPE);
    }

    @Override
    protected boolean defaultInputsOptional() {
        return false;
    }
}
