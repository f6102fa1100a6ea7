package com.novoflow.novoflow_backend.executor.impl;

import com.novoflow.novoflow_backend.config.EngineProperties;
import com.novoflow.novoflow_backend.exception.ValidationException;
import com.novoflow.novoflow_backend.executor.ExecutionContext;
import com.novoflow.novoflow_backend.executor.ExecutionStrategy;
import com.novoflow.novoflow_backend.executor.FileDescriptors;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.model.definition.spec.FileCheckSpec;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Executes file_check nodes: the file was uploaded elsewhere, so the node only checks that
 * its identifying field is set and describes the file for downstream nodes.
 */
@Component
@RequiredArgsConstructor
public class FileCheckStrategy implements ExecutionStrategy<FileCheckSpec> {

    private final EngineProperties properties;

    @Override
    public Class<FileCheckSpec> supportedType() {
        return FileCheckSpec.class;
    }

    @Override
    public NodeExecutionResult execute(FileCheckSpec spec, ExecutionContext context) {
        String field = spec.getIdentifierField() != null ? spec.getIdentifierField() : "filename";
        Object identifier = context.config().get(field);
        if (Values.isEmpty(identifier)) {
            throw new ValidationException("No " + field + " specified for node " + context.nodeName());
        }

        Map<String, Object> descriptor = FileDescriptors.fromConfig(
                context.config(), spec.getDescriptorType(), properties.getPublicBaseUrl());

        RequestEnvelope request = RequestEnvelope.builder()
                .type(FileCheckSpec.TYPE)
                .filename(String.valueOf(identifier))
                .build();
        ResponseEnvelope response = ResponseEnvelope.builder()
                .status(200)
                .statusText("OK")
                .data(descriptor)
                .build();
        return new NodeExecutionResult(descriptor, request, response);
    }
}
