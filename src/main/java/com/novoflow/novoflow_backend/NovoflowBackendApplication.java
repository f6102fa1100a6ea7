package com.novoflow.novoflow_backend;

import com.novoflow.novoflow_backend.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EngineProperties.class)
public class NovoflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(NovoflowBackendApplication.class, args);
    }
}
