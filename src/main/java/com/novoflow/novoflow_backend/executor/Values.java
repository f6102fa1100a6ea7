package com.novoflow.novoflow_backend.executor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed JSON trees (maps, lists, scalars) that flow between nodes.
 */
public final class Values {

    private Values() {}

    /** Recursive copy of maps and lists; scalars are shared. */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), deepCopy(v)));
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(deepCopy(v)));
            return (T) copy;
        }
        return value;
    }

    /** null, "", empty map and empty list count as "nothing there". */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        if (value instanceof List<?> l) return l.isEmpty();
        return false;
    }

    public static boolean isPresent(Object value) {
        return !isEmpty(value);
    }

    /** Falsy the way the canvas treats config values: null, false, 0 and "". */
    public static boolean isFalsy(Object value) {
        if (value == null) return true;
        if (value instanceof Boolean b) return !b;
        if (value instanceof Number n) return n.doubleValue() == 0d;
        if (value instanceof String s) return s.isEmpty();
        return false;
    }

    /** Explicit boolean false or the string "false". Absent values do not count. */
    public static boolean isExplicitFalse(Object value) {
        return Boolean.FALSE.equals(value) || (value instanceof String s && "false".equalsIgnoreCase(s.trim()));
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    @SafeVarargs
    public static <T> T firstPresent(T... candidates) {
        for (T candidate : candidates) {
            if (isPresent(candidate)) return candidate;
        }
        return null;
    }
}
