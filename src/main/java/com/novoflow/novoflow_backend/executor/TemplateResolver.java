package com.novoflow.novoflow_backend.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interpolates {{path}} placeholders inside strings, lists and maps.
 *
 * <pre>
 *   template := ( text | "{{" path "}}" )*
 *   path     := ident ( "." segment | "[" digits "]" )*
 *   segment  := ident | digits
 * </pre>
 *
 * A string that is exactly one placeholder resolves to the raw value, keeping its type.
 * Embedded placeholders are stringified, maps and lists as JSON. Missing paths and unknown
 * roots resolve to "". A placeholder that does not parse as a path stays as literal text.
 * Resolution is pure lookup: nothing in a template is ever evaluated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateResolver {

    private static final Object MISSING = new Object();

    private final ObjectMapper objectMapper;

    public Object resolve(Object template, PipelineNode node, Map<String, Object> inputData) {
        return resolve(template, TemplateContext.of(node, inputData));
    }

    public Object resolve(Object template, TemplateContext context) {
        if (template instanceof String s) {
            return resolveString(s, context);
        }
        if (template instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((key, value) -> resolved.put(String.valueOf(key), resolve(value, context)));
            return resolved;
        }
        if (template instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            list.forEach(item -> resolved.add(resolve(item, context)));
            return resolved;
        }
        return template;
    }

    /** Like {@link #resolve} but always yields a string ("" for null). */
    public String resolveToString(Object template, TemplateContext context) {
        Object value = resolve(template, context);
        if (value == null) return "";
        return value instanceof String s ? s : stringify(value);
    }

    public static boolean containsTemplate(Object value) {
        return value instanceof String s && s.contains("{{");
    }

    /** Reserved dispatcher flags look like __name__; they are never sent as request content. */
    public static boolean isFlagKey(String key) {
        return key != null && key.length() > 4 && key.startsWith("__") && key.endsWith("__");
    }

    public static Map<String, Object> stripFlags(Map<String, Object> values) {
        Map<String, Object> stripped = new LinkedHashMap<>();
        if (values == null) return stripped;
        values.forEach((key, value) -> {
            if (!isFlagKey(key)) stripped.put(key, value);
        });
        return stripped;
    }

    private Object resolveString(String template, TemplateContext context) {
        if (!template.contains("{{")) return template;

        List<Part> parts = new TemplateParser(template).parse();

        if (parts.size() == 1 && parts.get(0) instanceof Placeholder only) {
            Object value = lookup(only.path(), context);
            if (value == MISSING) {
                log.debug("Template path '{}' resolved to nothing", only.source());
                return "";
            }
            return value;
        }

        StringBuilder out = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Text text) {
                out.append(text.value());
            } else if (part instanceof Placeholder placeholder) {
                Object value = lookup(placeholder.path(), context);
                if (value == MISSING) {
                    log.debug("Template path '{}' resolved to nothing", placeholder.source());
                } else if (value != null) {
                    out.append(value instanceof String s ? s : stringify(value));
                }
            }
        }
        return out.toString();
    }

    private Object lookup(List<Object> path, TemplateContext context) {
        Object current = context.root((String) path.get(0));
        if (current == null) return MISSING;
        for (int i = 1; i < path.size(); i++) {
            Object segment = path.get(i);
            if (current instanceof Map<?, ?> map) {
                String key = String.valueOf(segment);
                if (!map.containsKey(key)) return MISSING;
                current = map.get(key);
            } else if (current instanceof List<?> list) {
                Integer index = asIndex(segment);
                if (index == null || index < 0 || index >= list.size()) return MISSING;
                current = list.get(index);
            } else {
                return MISSING;
            }
        }
        return current == null ? MISSING : current;
    }

    private Integer asIndex(Object segment) {
        if (segment instanceof Integer i) return i;
        try {
            return Integer.parseInt(String.valueOf(segment));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String stringify(Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    // ── Parsing ────────────────────────────────────────────────────────────────

    private sealed interface Part permits Text, Placeholder {}

    private record Text(String value) implements Part {}

    // path holds String keys and Integer indexes; the first element is always the root name
    private record Placeholder(String source, List<Object> path) implements Part {}

    private static final class TemplateParser {

        private final String template;

        TemplateParser(String template) {
            this.template = template;
        }

        List<Part> parse() {
            List<Part> parts = new ArrayList<>();
            int pos = 0;
            while (pos < template.length()) {
                int open = template.indexOf("{{", pos);
                if (open < 0) {
                    parts.add(new Text(template.substring(pos)));
                    break;
                }
                int close = template.indexOf("}}", open + 2);
                if (close < 0) {
                    parts.add(new Text(template.substring(pos)));
                    break;
                }
                if (open > pos) {
                    parts.add(new Text(template.substring(pos, open)));
                }
                String inner = template.substring(open + 2, close).trim();
                List<Object> path = new PathParser(inner).parse();
                parts.add(path != null
                        ? new Placeholder(inner, path)
                        : new Text(template.substring(open, close + 2)));
                pos = close + 2;
            }
            return parts;
        }
    }

    private static final class PathParser {

        private final String source;
        private int pos;

        PathParser(String source) {
            this.source = source;
        }

        /** Returns null when the text is not a well-formed path. */
        List<Object> parse() {
            List<Object> path = new ArrayList<>();
            String root = identifier();
            if (root == null) return null;
            path.add(root);
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '.') {
                    pos++;
                    String key = identifier();
                    if (key == null) key = digits();
                    if (key == null) return null;
                    path.add(key);
                } else if (c == '[') {
                    pos++;
                    String index = digits();
                    if (index == null || pos >= source.length() || source.charAt(pos) != ']') return null;
                    pos++;
                    path.add(Integer.parseInt(index));
                } else {
                    return null;
                }
            }
            return path;
        }

        private String identifier() {
            int start = pos;
            if (pos >= source.length() || !isIdentifierStart(source.charAt(pos))) return null;
            pos++;
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) pos++;
            return source.substring(start, pos);
        }

        private String digits() {
            int start = pos;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) pos++;
            return pos > start ? source.substring(start, pos) : null;
        }

        private static boolean isIdentifierStart(char c) {
            return Character.isLetter(c) || c == '_' || c == '$';
        }

        private static boolean isIdentifierPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '-';
        }
    }
}
