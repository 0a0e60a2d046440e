package com.unifiedinbox.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Null-tolerant accessors over provider JSON decoded into maps.
 */
final class RawRecords {

    private RawRecords() {
    }

    static String str(Object value) {
        return value == null ? "" : value.toString();
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }

    static List<Map<String, Object>> mapList(Object value) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        List<Map<String, Object>> maps = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map) {
                maps.add(map(item));
            }
        }
        return maps;
    }

    static List<String> stringList(Object value) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        List<String> strings = new ArrayList<>();
        for (Object item : items) {
            if (item != null) {
                strings.add(item.toString());
            }
        }
        return strings;
    }

    static long number(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return value == null ? 0L : Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
