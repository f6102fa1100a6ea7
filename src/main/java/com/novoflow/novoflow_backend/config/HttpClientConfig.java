package com.novoflow.novoflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.executor.http.ApiClient;
import com.novoflow.novoflow_backend.executor.http.RestTemplateApiClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    // Used by api_call nodes for absolute URLs
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, EngineProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getApi().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getApi().getReadTimeoutMs()))
                .build();
    }

    @Bean
    public ApiClient apiClient(RestTemplateBuilder builder, EngineProperties properties, ObjectMapper objectMapper) {
        RestTemplate internal = builder
                .uriTemplateHandler(preEncoded())
                .rootUri(properties.getApi().getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(properties.getApi().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getApi().getReadTimeoutMs()))
                .build();
        return new RestTemplateApiClient(internal, objectMapper);
    }

    // api_call nodes encode their own query strings
    private static DefaultUriBuilderFactory preEncoded() {
        DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory();
        factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.NONE);
        return factory;
    }
}
