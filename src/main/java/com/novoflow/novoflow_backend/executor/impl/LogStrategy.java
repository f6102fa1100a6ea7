package com.novoflow.novoflow_backend.executor.impl;

import com.novoflow.novoflow_backend.executor.ExecutionContext;
import com.novoflow.novoflow_backend.executor.ExecutionStrategy;
import com.novoflow.novoflow_backend.executor.TemplateResolver;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.spec.LogSpec;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes log nodes: resolves the message and passes it downstream as {message, loggedAt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogStrategy implements ExecutionStrategy<LogSpec> {

    private final TemplateResolver templateResolver;

    @Override
    public Class<LogSpec> supportedType() {
        return LogSpec.class;
    }

    @Override
    public NodeExecutionResult execute(LogSpec spec, ExecutionContext context) {
        String message = spec.getMessage() != null
                ? templateResolver.resolveToString(spec.getMessage(), context.templateContext())
                : null;
        if (message == null || message.isEmpty()) {
            Object configured = context.config().get("message");
            message = Values.isPresent(configured) ? String.valueOf(configured) : "";
        }

        log.info("[{}] {}", context.nodeName(), message);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("loggedAt", Instant.now().toString());

        RequestEnvelope request = RequestEnvelope.builder()
                .type(LogSpec.TYPE)
                .message(message)
                .build();
        ResponseEnvelope response = ResponseEnvelope.builder()
                .status(200)
                .statusText("OK")
                .data(data)
                .build();
        return new NodeExecutionResult(data, request, response);
    }
}
