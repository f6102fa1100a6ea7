package com.novoflow.novoflow_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the "novoflow" prefix of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "novoflow")
public class EngineProperties {

    private Nodes nodes = new Nodes();
    private Api api = new Api();
    private Script script = new Script();
    private History history = new History();

    // Origin used to turn blob:/root-relative file URLs into something another session can fetch
    private String publicBaseUrl = "http://localhost:8080";

    @Data
    public static class Nodes {
        // Directory holding <type>/node.json documents
        private String location = "classpath:nodes";
    }

    @Data
    public static class Api {
        // Base URL that relative api_call endpoints are sent to
        private String baseUrl = "http://localhost:8080";
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 120_000;
    }

    @Data
    public static class Script {
        private String interpreter = "node";
        private long timeoutMs = 10_000L;
    }

    @Data
    public static class History {
        private int maxSize = 50;
    }
}
