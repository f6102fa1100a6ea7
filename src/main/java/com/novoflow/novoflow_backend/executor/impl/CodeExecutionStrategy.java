package com.novoflow.novoflow_backend.executor.impl;

import com.novoflow.novoflow_backend.engine.ScriptRunner;
import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.exception.ScriptExecutionException;
import com.novoflow.novoflow_backend.executor.ExecutionContext;
import com.novoflow.novoflow_backend.executor.ExecutionStrategy;
import com.novoflow.novoflow_backend.executor.TemplateResolver;
import com.novoflow.novoflow_backend.model.definition.spec.CodeExecutionSpec;
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
 * Executes code_execution nodes.
 *
 * What the script sees:
 *   input   resolved upstream data, keyed by input handle id
 *   config  the node's config
 *   node    {id, type, label, status}
 *   console log/info/warn/error, re-logged here under the node label
 *   Date, JSON
 *
 * Use `return` to hand a value downstream. Returning nothing yields {executed: true, timestamp}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CodeExecutionStrategy implements ExecutionStrategy<CodeExecutionSpec> {

    private static final int CODE_PREVIEW_LENGTH = 200;

    private final ScriptRunner     scriptRunner;
    private final TemplateResolver templateResolver;

    @Override
    public Class<CodeExecutionSpec> supportedType() {
        return CodeExecutionSpec.class;
    }

    @Override
    public NodeExecutionResult execute(CodeExecutionSpec spec, ExecutionContext context) {
        String code = spec.getCode() != null
                ? templateResolver.resolveToString(spec.getCode(), context.templateContext())
                : "";
        if (code.isBlank()) {
            Object configured = context.config().get("code");
            code = configured != null ? String.valueOf(configured) : "";
        }
        if (code.isBlank()) {
            throw new ConfigurationException("No code provided for node " + context.nodeName()
                    + ". Open the node and write your script.");
        }

        ScriptRunner.ScriptScope scope = new ScriptRunner.ScriptScope(
                context.inputData(), context.config(), context.templateContext().node());
        ScriptRunner.ScriptResult result = scriptRunner.run(spec.getLanguage(), code, scope, spec.getTimeoutMs());

        relayConsole(context.nodeName(), result);

        if (!result.success()) {
            log.warn("Code execution in {} failed: {}", context.nodeName(), result.error());
            throw new ScriptExecutionException(result.error());
        }

        Object data = result.returned() ? result.output() : executedMarker();

        RequestEnvelope request = RequestEnvelope.builder()
                .type(CodeExecutionSpec.TYPE)
                .code(preview(code))
                .build();
        ResponseEnvelope response = ResponseEnvelope.builder()
                .status(200)
                .statusText("Executed")
                .data(data)
                .build();
        return new NodeExecutionResult(data, request, response);
    }

    private void relayConsole(String nodeName, ScriptRunner.ScriptResult result) {
        if (result.logs() == null) return;
        for (ScriptRunner.ScriptLog line : result.logs()) {
            switch (line.level()) {
                case "error" -> log.error("[Code Execution: {}] {}", nodeName, line.message());
                case "warn"  -> log.warn("[Code Execution: {}] {}", nodeName, line.message());
                case "debug" -> log.debug("[Code Execution: {}] {}", nodeName, line.message());
                default      -> log.info("[Code Execution: {}] {}", nodeName, line.message());
            }
        }
    }

    private Map<String, Object> executedMarker() {
        Map<String, Object> marker = new LinkedHashMap<>();
        marker.put("executed", true);
        marker.put("timestamp", Instant.now().toString());
        return marker;
    }

    private String preview(String code) {
        return code.length() > CODE_PREVIEW_LENGTH ? code.substring(0, CODE_PREVIEW_LENGTH) + "..." : code;
    }
}
