package io.stagewise.core.util;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/// Minimal JSON writer for maps, lists and scalars, without external dependencies.
///
/// Used for prompt samples and sandbox preload files. Values that are not JSON types are
/// written as their string form. For parsing, use the serialization module.
public final class JsonText {

    private static final String INDENT = "  ";

    private JsonText() {}

    /// Writes a value as compact JSON.
    public static String write(Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value, false, 0);
        return out.toString();
    }

    /// Writes a value as JSON indented by two spaces per level.
    public static String writePretty(Object value) {
        StringBuilder out = new StringBuilder();
        append(out, value, true, 0);
        return out.toString();
    }

    private static void append(StringBuilder out, Object value, boolean pretty, int depth) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Boolean || value instanceof Integer || value instanceof Long) {
            out.append(value);
        } else if (value instanceof Number number) {
            double d = number.doubleValue();
            out.append(Double.isNaN(d) || Double.isInfinite(d) ? "NaN" : number.toString());
        } else if (value instanceof Map<?, ?> map) {
            appendObject(out, map, pretty, depth);
        } else if (value instanceof Collection<?> collection) {
            appendArray(out, collection.iterator(), collection.isEmpty(), pretty, depth);
        } else if (value instanceof Object[] array) {
            appendArray(out, Arrays.asList(array).iterator(), array.length == 0, pretty, depth);
        } else {
            quote(out, value.toString());
        }
    }

    private static void appendObject(StringBuilder out, Map<?, ?> map, boolean pretty, int depth) {
        if (map.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        Iterator<? extends Map.Entry<?, ?>> entries = map.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<?, ?> entry = entries.next();
            newline(out, pretty, depth + 1);
            quote(out, String.valueOf(entry.getKey()));
            out.append(pretty ? ": " : ":");
            append(out, entry.getValue(), pretty, depth + 1);
            if (entries.hasNext()) {
                out.append(',');
            }
        }
        newline(out, pretty, depth);
        out.append('}');
    }

    private static void appendArray(
            StringBuilder out, Iterator<?> items, boolean empty, boolean pretty, int depth) {
        if (empty) {
            out.append("[]");
            return;
        }
        out.append('[');
        while (items.hasNext()) {
            newline(out, pretty, depth + 1);
            append(out, items.next(), pretty, depth + 1);
            if (items.hasNext()) {
                out.append(',');
            }
        }
        newline(out, pretty, depth);
        out.append(']');
    }

    private static void newline(StringBuilder out, boolean pretty, int depth) {
        if (pretty) {
            out.append('\n').append(INDENT.repeat(depth));
        }
    }

    private static void quote(StringBuilder out, String text) {
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
