package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.model.definition.spec.ExecutionSpec;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ExecutionStrategyRegistry {

    private final List<ExecutionStrategy<?>> strategies;
    private final Map<Class<?>, ExecutionStrategy<?>> registry = new HashMap<>();

    @PostConstruct
    public void init() {
        strategies.forEach(strategy -> registry.put(strategy.supportedType(), strategy));
    }

    @SuppressWarnings("unchecked")
    public <S extends ExecutionSpec> ExecutionStrategy<S> get(S spec) {
        ExecutionStrategy<?> strategy = spec != null ? registry.get(spec.getClass()) : null;
        if (strategy == null) {
            String type = spec != null ? spec.getType() : null;
            throw new ConfigurationException("Unknown execution type: " + type);
        }
        return (ExecutionStrategy<S>) strategy;
    }

    public boolean isSupported(ExecutionSpec spec) {
        return spec != null && registry.containsKey(spec.getClass());
    }
}
