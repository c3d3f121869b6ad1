package org.eqschema.engine.serialization;

import org.eqschema.engine.render.ExpressionRenderer;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Minimal JSON writer for trees of Map, List, String, Number, Boolean and null.
 *
 * Hand-written string building, no reflection. Maps keep their iteration order,
 * so callers pass LinkedHashMap to control field order.
 */
final class JsonWriter {

    private static final String INDENT = "  ";

    private final boolean pretty;
    private final StringBuilder json = new StringBuilder();

    private JsonWriter(boolean pretty) {
        this.pretty = pretty;
    }

    static String write(Object value, boolean pretty) {
        JsonWriter writer = new JsonWriter(pretty);
        writer.value(value, 0);
        return writer.json.toString();
    }

    private void value(Object value, int depth) {
        if (value == null) {
            json.append("null");
        } else if (value instanceof String s) {
            json.append('"').append(escapeJson(s)).append('"');
        } else if (value instanceof Double d) {
            json.append(ExpressionRenderer.formatNumber(d));
        } else if (value instanceof Number || value instanceof Boolean) {
            json.append(value);
        } else if (value instanceof Map<?, ?> map) {
            object(map, depth);
        } else if (value instanceof List<?> list) {
            array(list, depth);
        } else {
            throw new IllegalArgumentException("Cannot write " + value.getClass().getName() + " as JSON");
        }
    }

    private void object(Map<?, ?> map, int depth) {
        if (map.isEmpty()) {
            json.append("{}");
            return;
        }
        json.append('{');
        Iterator<? extends Map.Entry<?, ?>> entries = map.entrySet().iterator();
        while (entries.hasNext()) {
            Map.Entry<?, ?> entry = entries.next();
            newline(depth + 1);
            json.append('"').append(escapeJson(String.valueOf(entry.getKey()))).append('"');
            json.append(pretty ? ": " : ":");
            value(entry.getValue(), depth + 1);
            if (entries.hasNext()) {
                json.append(',');
            }
        }
        newline(depth);
        json.append('}');
    }

    private void array(List<?> list, int depth) {
        if (list.isEmpty()) {
            json.append("[]");
            return;
        }
        json.append('[');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                json.append(',');
            }
            newline(depth + 1);
            value(list.get(i), depth + 1);
        }
        newline(depth);
        json.append(']');
    }

    private void newline(int depth) {
        if (pretty) {
            json.append('\n').append(INDENT.repeat(depth));
        }
    }

    static String escapeJson(String s) {
        StringBuilder escaped = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> escaped.append("\\\"");
                case '\\' -> escaped.append("\\\\");
                case '\n' -> escaped.append("\\n");
                case '\r' -> escaped.append("\\r");
                case '\t' -> escaped.append("\\t");
                case '\b' -> escaped.append("\\b");
                case '\f' -> escaped.append("\\f");
                default -> {
                    if (c < 0x20) {
                        escaped.append(String.format("\\u%04x", (int) c));
                    } else {
                        escaped.append(c);
                    }
                }
            }
        }
        return escaped.toString();
    }
}
