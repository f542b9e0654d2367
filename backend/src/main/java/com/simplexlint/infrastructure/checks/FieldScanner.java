package com.simplexlint.infrastructure.checks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Key-value scanner shared by the BASELINE, EVAL and DETERMINISM checks.
 *
 * A line whose trimmed text starts with {@code name:} for a recognised name opens that field;
 * the rest of the line is its value. Following {@code -} lines are items of the most recently
 * opened field. Other lines are ignored.
 *
 * <pre>
 *   reference: "v1.0"      → reference = "\"v1.0\"", items []
 *   preserve:              → preserve  = "",         items ["existing API"]
 *     - existing API
 * </pre>
 */
public final class FieldScanner {

    private FieldScanner() {
    }

    /**
     * A scanned field.
     *
     * @param value text after the colon on the header line, trimmed (may be empty)
     * @param items dash items following the header, dash stripped and trimmed
     */
    public record Field(String value, List<String> items) {

        public boolean hasValue() {
            return !value.isEmpty();
        }
    }

    /**
     * @param content block content, may be empty
     * @param names   recognised field names, without the colon
     * @return fields that appear in the content, in order of first appearance
     */
    public static Map<String, Field> scan(String content, Set<String> names) {
        Map<String, String> values = new LinkedHashMap<>();
        Map<String, List<String>> items = new LinkedHashMap<>();
        String current = null;

        if (content != null) {
            for (String line : content.split("\n")) {
                String trimmed = line.strip();
                if (trimmed.isEmpty()) {
                    continue;
                }

                String header = headerName(trimmed, names);
                if (header != null) {
                    values.put(header, trimmed.substring(header.length() + 1).strip());
                    items.computeIfAbsent(header, k -> new ArrayList<>());
                    current = header;
                } else if (trimmed.startsWith("-") && current != null) {
                    items.get(current).add(trimmed.substring(1).strip());
                }
            }
        }

        Map<String, Field> fields = new LinkedHashMap<>();
        values.forEach((name, value) -> fields.put(name, new Field(value, List.copyOf(items.get(name)))));
        return fields;
    }

    /**
     * Value of a field, or an empty string when absent.
     */
    public static String valueOf(Map<String, Field> fields, String name) {
        Field field = fields.get(name);
        return field != null ? field.value() : "";
    }

    private static String headerName(String trimmed, Set<String> names) {
        for (String name : names) {
            if (trimmed.startsWith(name + ":")) {
                return name;
            }
        }
        return null;
    }
}
