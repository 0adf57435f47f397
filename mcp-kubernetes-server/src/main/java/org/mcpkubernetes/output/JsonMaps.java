package org.mcpkubernetes.output;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers for resources held as plain JSON trees ({@code Map}/{@code List}/scalars).
 */
public final class JsonMaps {

    private JsonMaps() {
    }

    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(element -> copy.add(copyValue(element)));
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Optional<Map<String, Object>> map(Object value) {
        return value instanceof Map<?, ?> map ? Optional.of((Map<String, Object>) map) : Optional.empty();
    }

    public static Optional<Object> nested(Map<String, Object> root, String... path) {
        Object current = root;
        for (String segment : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    public static String string(Map<String, Object> root, String... path) {
        return nested(root, path).map(Object::toString).orElse("");
    }

    public static long number(Map<String, Object> root, String... path) {
        return nested(root, path)
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).longValue())
                .orElse(0L);
    }

    public static List<?> list(Map<String, Object> root, String... path) {
        return nested(root, path).filter(List.class::isInstance).map(value -> (List<?>) value).orElse(List.of());
    }
}
