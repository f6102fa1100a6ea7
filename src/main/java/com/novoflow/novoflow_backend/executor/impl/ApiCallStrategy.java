package com.novoflow.novoflow_backend.executor.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.exception.ConfigurationException;
import com.novoflow.novoflow_backend.exception.HttpCallException;
import com.novoflow.novoflow_backend.exception.NetworkException;
import com.novoflow.novoflow_backend.executor.ExecutionContext;
import com.novoflow.novoflow_backend.executor.ExecutionStrategy;
import com.novoflow.novoflow_backend.executor.TemplateContext;
import com.novoflow.novoflow_backend.executor.TemplateResolver;
import com.novoflow.novoflow_backend.executor.Values;
import com.novoflow.novoflow_backend.executor.http.ApiClient;
import com.novoflow.novoflow_backend.executor.http.RequestConfig;
import com.novoflow.novoflow_backend.executor.http.ResponseEnvelopes;
import com.novoflow.novoflow_backend.model.definition.spec.ApiCallSpec;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.model.execution.RequestEnvelope;
import com.novoflow.novoflow_backend.model.execution.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Executes api_call nodes.
 *
 * The definition's endpoint, method, headers, queryParams and payload are templates. Besides
 * plain entries, headers and payload carry __flag__ keys that steer the request and are never
 * sent themselves:
 *
 *   headers:     __auth_type__ (basic | bearer | custom), __basic_auth_username__,
 *                __basic_auth_password__, __bearer_token__, __custom_auth_header_name__,
 *                __custom_auth_header_value__, __custom_headers__, __send_headers__
 *   queryParams: __send_query_params__, __query_params__
 *   payload:     __send_body__, __body_content_type__, __body_specify__ (json | expression),
 *                __body_json__, __body_raw__, __legacy_payload__
 *
 * Absolute URLs are called directly; relative ones go through the injected ApiClient.
 * The response envelope is captured for every answer; non-2xx raises HttpCallException.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiCallStrategy implements ExecutionStrategy<ApiCallSpec> {

    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");
    private static final Set<String> RAW_CONTENT_TYPES = Set.of("raw", "text", "xml");

    private static final Map<String, String> CONTENT_TYPES = Map.of(
            "json",                  "application/json",
            "form-data",             "multipart/form-data",
            "x-www-form-urlencoded", "application/x-www-form-urlencoded",
            "text",                  "text/plain",
            "xml",                   "application/xml",
            "raw",                   "text/plain");

    private static final Pattern CONFIG_PLACEHOLDER = Pattern.compile("^\\{\\{\\s*config\\.([^}]+?)\\s*}}$");

    // "key": {{path}} with the placeholder unquoted
    private static final Pattern UNQUOTED_PLACEHOLDER = Pattern.compile("(\"[^\"]+\":\\s*)(\\{\\{[^}]+}})(\\s*[,}])");

    private static final int JSON_PREVIEW_LENGTH = 200;

    private final TemplateResolver templateResolver;
    private final RestTemplate     restTemplate;
    private final ApiClient        apiClient;
    private final ObjectMapper     objectMapper;

    @Override
    public Class<ApiCallSpec> supportedType() {
        return ApiCallSpec.class;
    }

    @Override
    public NodeExecutionResult execute(ApiCallSpec spec, ExecutionContext context) {
        TemplateContext templates = context.templateContext();

        String endpoint = resolveEndpoint(spec, context, templates);
        String method   = resolveMethod(spec, context, templates);

        Map<String, Object> queryParams = resolveQueryParams(spec, templates);
        String url = appendQuery(endpoint, queryParams);

        Map<String, String> headers = resolveHeaders(spec, templates);
        Object body = resolveBody(spec, context, templates, headers);

        boolean sendsBody = METHODS_WITH_BODY.contains(method) && body != null;
        if (sendsBody && !(body instanceof String) && !hasHeader(headers, HttpHeaders.CONTENT_TYPE)) {
            headers.put(HttpHeaders.CONTENT_TYPE, "application/json");
        }

        RequestEnvelope request = RequestEnvelope.builder()
                .method(method)
                .url(url)
                .headers(new LinkedHashMap<>(headers))
                .queryParams(queryParams)
                .body(body)
                .build();

        log.info("[HTTP Request] {} {} for node {}", method, url, context.node().getId());

        ResponseEnvelope response;
        try {
            response = isAbsolute(url)
                    ? callDirect(method, url, headers, sendsBody ? body : null)
                    : callApiClient(method, url, headers, body);
        } catch (RestClientException ex) {
            log.error("API call {} {} failed without a response: {}", method, url, ex.getMessage());
            String detail = ex.getMessage() != null
                    ? ex.getMessage()
                    : "No response from server. Please check your connection and try again.";
            throw new NetworkException(detail, request, ex);
        }

        if (!response.isSuccessful()) {
            throw new HttpCallException("HTTP " + response.getStatus() + ": " + response.getStatusText(), request, response);
        }
        return new NodeExecutionResult(response.getData(), request, response);
    }

    // ── Endpoint and method ───────────────────────────────────────────────────

    private String resolveEndpoint(ApiCallSpec spec, ExecutionContext context, TemplateContext templates) {
        String endpoint = spec.getEndpoint() != null
                ? templateResolver.resolveToString(spec.getEndpoint(), templates).trim()
                : "";
        if (endpoint.isEmpty()) {
            Object fallback = context.defaultConfig().get("url");
            endpoint = fallback != null ? String.valueOf(fallback).trim() : "";
        }
        if (endpoint.isEmpty()) {
            throw new ConfigurationException("Node " + context.nodeName()
                    + " has api_call type but no endpoint specified. Please configure the URL in the node settings.");
        }
        return endpoint;
    }

    private String resolveMethod(ApiCallSpec spec, ExecutionContext context, TemplateContext templates) {
        String method = spec.getMethod() != null
                ? templateResolver.resolveToString(spec.getMethod(), templates).trim()
                : "POST";
        if (method.isEmpty()) {
            Object fallback = context.defaultConfig().get("method");
            method = Values.isPresent(fallback) ? String.valueOf(fallback) : "POST";
        }
        method = method.toUpperCase(Locale.ROOT);
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new ConfigurationException("Unsupported HTTP method: " + method);
        }
        return method;
    }

    // ── Query parameters ──────────────────────────────────────────────────────

    private Map<String, Object> resolveQueryParams(ApiCallSpec spec, TemplateContext templates) {
        if (spec.getQueryParams() == null) return null;
        Object resolved = templateResolver.resolve(spec.getQueryParams(), templates);

        Map<String, Object> params = new LinkedHashMap<>();
        if (resolved instanceof String s) {
            params.putAll(parseObject(s));
        } else if (resolved instanceof Map<?, ?>) {
            Map<String, Object> map = Values.asMap(resolved);
            if (Values.isExplicitFalse(map.get("__send_query_params__"))) return null;
            params.putAll(TemplateResolver.stripFlags(map));
            Object userParams = map.get("__query_params__");
            if (userParams instanceof String s) {
                params.putAll(parseObject(s));
            } else if (userParams instanceof Map<?, ?>) {
                params.putAll(Values.asMap(userParams));
            }
        }
        return params.isEmpty() ? null : params;
    }

    private String appendQuery(String endpoint, Map<String, Object> queryParams) {
        if (queryParams == null || queryParams.isEmpty()) return endpoint;
        String query = queryParams.entrySet().stream()
                .map(e -> UriUtils.encodeQueryParam(e.getKey(), StandardCharsets.UTF_8) + "="
                        + UriUtils.encodeQueryParam(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        return endpoint + (endpoint.contains("?") ? "&" : "?") + query;
    }

    // ── Headers ───────────────────────────────────────────────────────────────

    private Map<String, String> resolveHeaders(ApiCallSpec spec, TemplateContext templates) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (spec.getHeaders() == null) return headers;

        Object resolved = templateResolver.resolve(spec.getHeaders(), templates);
        if (resolved instanceof String s) {
            parseObject(s).forEach((name, value) -> headers.put(name, stringOrNull(value)));
            return dropEmpty(headers);
        }
        Map<String, Object> map = Values.asMap(resolved);
        if (map == null) return headers;

        Map<String, String> auth = new LinkedHashMap<>();
        applyAuth(map, auth);
        headers.putAll(auth);
        TemplateResolver.stripFlags(map).forEach((name, value) -> headers.put(name, stringOrNull(value)));

        Object custom = map.get("__custom_headers__");
        if (custom instanceof String s) {
            parseObject(s).forEach((name, value) -> headers.put(name, stringOrNull(value)));
        } else if (custom instanceof Map<?, ?>) {
            Values.asMap(custom).forEach((name, value) -> headers.put(name, stringOrNull(value)));
        }

        Map<String, String> kept = dropEmpty(headers);
        if (Values.isExplicitFalse(map.get("__send_headers__"))) {
            kept.keySet().removeIf(name -> !auth.containsKey(name) && !isAuthLike(name));
        }
        return kept;
    }

    private void applyAuth(Map<String, Object> flags, Map<String, String> headers) {
        String authType = Values.asString(flags.get("__auth_type__"));
        if (authType == null) return;

        switch (authType.toLowerCase(Locale.ROOT)) {
            case "basic" -> {
                Object username = flags.get("__basic_auth_username__");
                Object password = flags.get("__basic_auth_password__");
                if (!Values.isFalsy(username) && !Values.isFalsy(password)) {
                    String encoded = Base64.getEncoder()
                            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
                    headers.put(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
                }
            }
            case "bearer" -> {
                Object token = flags.get("__bearer_token__");
                if (!Values.isFalsy(token)) headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + token);
            }
            case "custom" -> {
                Object name  = flags.get("__custom_auth_header_name__");
                Object value = flags.get("__custom_auth_header_value__");
                if (!Values.isFalsy(name) && !Values.isFalsy(value)) headers.put(String.valueOf(name), String.valueOf(value));
            }
            default -> { }
        }
    }

    private boolean isAuthLike(String headerName) {
        String lower = headerName.toLowerCase(Locale.ROOT);
        return lower.equals("authorization") || lower.contains("auth") || lower.contains("token");
    }

    private Map<String, String> dropEmpty(Map<String, String> headers) {
        Map<String, String> kept = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (value != null && !value.isEmpty()) kept.put(name, value);
        });
        return kept;
    }

    // ── Body ──────────────────────────────────────────────────────────────────

    private Object resolveBody(ApiCallSpec spec, ExecutionContext context, TemplateContext templates, Map<String, String> headers) {
        Map<String, Object> payload = spec.getPayload();
        if (payload == null) return null;

        // A {{config.x}} body_json is read raw so the JSON text is parsed before anything is interpolated into it
        Map<String, Object> toResolve = new LinkedHashMap<>(payload);
        boolean rawBodyJson = false;
        Object bodyJsonRaw = null;
        if (payload.get("__body_json__") instanceof String template) {
            Matcher m = CONFIG_PLACEHOLDER.matcher(template.trim());
            if (m.matches()) {
                rawBodyJson = true;
                bodyJsonRaw = context.config().get(m.group(1));
                toResolve.remove("__body_json__");
            }
        }

        Map<String, Object> resolved = Values.asMap(templateResolver.resolve(toResolve, templates));
        if (rawBodyJson) resolved.put("__body_json__", bodyJsonRaw);

        if (resolved.keySet().stream().noneMatch(TemplateResolver::isFlagKey)) {
            return resolved.isEmpty() ? null : resolved;
        }
        if (Values.isExplicitFalse(resolved.get("__send_body__"))) {
            return null;
        }

        String contentType = Values.asString(resolved.get("__body_content_type__"));
        String specify     = Values.asString(resolved.get("__body_specify__"));
        Object bodyJson    = resolved.get("__body_json__");
        Object bodyRaw     = resolved.get("__body_raw__");
        Object legacy      = resolved.get("__legacy_payload__");

        Object body = null;
        if ("json".equals(specify) && !Values.isFalsy(bodyJson)) {
            body = parseJsonBody(bodyJson, templates);
        } else if ("expression".equals(specify) && !Values.isFalsy(bodyJson)) {
            body = parseExpressionBody(bodyJson, templates);
        } else if (!Values.isFalsy(bodyRaw) && contentType != null && RAW_CONTENT_TYPES.contains(contentType)) {
            body = String.valueOf(bodyRaw);
        } else if (!Values.isFalsy(legacy)) {
            body = legacy;
        }

        if (contentType != null && CONTENT_TYPES.containsKey(contentType) && !hasHeader(headers, HttpHeaders.CONTENT_TYPE)) {
            headers.put(HttpHeaders.CONTENT_TYPE, CONTENT_TYPES.get(contentType));
        }
        return body;
    }

    private Object parseJsonBody(Object bodyJson, TemplateContext templates) {
        if (!(bodyJson instanceof String text)) {
            return templateResolver.resolve(bodyJson, templates);
        }
        if (text.isBlank()) {
            throw new ConfigurationException("Invalid JSON body: body_json is empty");
        }
        String fixed = UNQUOTED_PLACEHOLDER.matcher(text).replaceAll("$1\"$2\"$3");
        try {
            Object parsed = objectMapper.readValue(fixed, Object.class);
            return templateResolver.resolve(parsed, templates);
        } catch (JsonProcessingException e) {
            String preview = text.length() > JSON_PREVIEW_LENGTH ? text.substring(0, JSON_PREVIEW_LENGTH) + "..." : text;
            throw new ConfigurationException("Invalid JSON body: " + e.getOriginalMessage() + ". JSON preview: " + preview, e);
        }
    }

    private Object parseExpressionBody(Object bodyJson, TemplateContext templates) {
        if (!(bodyJson instanceof String text)) {
            return templateResolver.resolve(bodyJson, templates);
        }
        try {
            return templateResolver.resolve(objectMapper.readValue(text, Object.class), templates);
        } catch (JsonProcessingException e) {
            log.debug("Expression body is not JSON, sending it as text: {}", e.getOriginalMessage());
            return templateResolver.resolve(text, templates);
        }
    }

    // ── Transport ─────────────────────────────────────────────────────────────

    private ResponseEnvelope callDirect(String method, String url, Map<String, String> headers, Object body) {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::set);

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid URL: " + url, e);
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.valueOf(method), new HttpEntity<>(wireBody(body, httpHeaders), httpHeaders), String.class);
            return ResponseEnvelopes.of(response.getStatusCode(), response.getHeaders(), response.getBody(), objectMapper);
        } catch (HttpStatusCodeException ex) {
            return ResponseEnvelopes.of(ex.getStatusCode(), ex.getResponseHeaders(), ex.getResponseBodyAsString(), objectMapper);
        }
    }

    private ResponseEnvelope callApiClient(String method, String url, Map<String, String> headers, Object logicalBody) {
        HttpHeaders httpHeaders = new HttpHeaders();
        headers.forEach(httpHeaders::set);
        Object body = wireBody(logicalBody, httpHeaders);
        return switch (method) {
            case "GET"           -> apiClient.get(url, RequestConfig.of(headers));
            case "DELETE"        -> apiClient.get(url, new RequestConfig(headers, "DELETE"));
            case "POST"          -> apiClient.post(url, body, RequestConfig.of(headers));
            case "PUT", "PATCH"  -> apiClient.post(url, body, new RequestConfig(headers, method));
            default              -> throw new ConfigurationException("Unsupported HTTP method: " + method);
        };
    }

    // Strings go out as-is, multipart maps through the form converter, everything else as JSON text
    private Object wireBody(Object body, HttpHeaders headers) {
        if (body == null || body instanceof String) return body;
        String contentType = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        if (contentType != null && contentType.startsWith("multipart/form-data") && body instanceof Map<?, ?> map) {
            MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
            map.forEach((k, v) -> form.add(String.valueOf(k), v));
            return form;
        }
        if (contentType != null && contentType.startsWith("application/x-www-form-urlencoded") && body instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> UriUtils.encodeQueryParam(String.valueOf(e.getKey()), StandardCharsets.UTF_8) + "="
                            + UriUtils.encodeQueryParam(String.valueOf(e.getValue()), StandardCharsets.UTF_8))
                    .collect(Collectors.joining("&"));
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Request body cannot be serialised: " + e.getOriginalMessage(), e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            Object parsed = objectMapper.readValue(json, Object.class);
            Map<String, Object> map = Values.asMap(parsed);
            return map != null ? map : Map.of();
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON value where an object was expected: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static boolean isAbsolute(String url) {
        return url.startsWith("http://") || url.startsWith("https://");
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(h -> h.equalsIgnoreCase(name));
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
