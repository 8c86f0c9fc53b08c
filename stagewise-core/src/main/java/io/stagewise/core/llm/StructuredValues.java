package io.stagewise.core.llm;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Lenient accessors for decoded structured output.
///
/// Models occasionally emit `"true"` for a boolean or a number for a string; these helpers
/// coerce such values and fail with {@link IllegalArgumentException} otherwise.
public final class StructuredValues {

    private StructuredValues() {}

    public static String string(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        return value != null ? value.toString() : "";
    }

    public static boolean bool(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("yes")) {
                return true;
            }
            if (normalized.equals("false") || normalized.equals("no")) {
                return false;
            }
        }
        throw new IllegalArgumentException("Field '" + field + "' is not a boolean: " + value);
    }

    public static List<Map<String, Object>> objects(Map<String, Object> raw, String field) {
        Object value = raw.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("Field '" + field + "' is not a list");
        }
        List<Map<String, Object>> objects = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Field '" + field + "' holds a non-object item");
            }
            Map<String, Object> object = new LinkedHashMap<>();
            map.forEach((k, v) -> object.put(String.valueOf(k), v));
            objects.add(object);
        }
        return objects;
    }
}
