package com.healthsentinel.probes.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Params {
    private Params() {
    }

    public static String requiredString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return value.toString();
    }

    public static String optionalString(Map<String, Object> params, String key, String fallback) {
        Object value = params.get(key);
        return value == null ? fallback : value.toString();
    }

    public static int requiredInt(Map<String, Object> params, String key) {
        if (!params.containsKey(key)) {
            throw new IllegalArgumentException("Missing required parameter: " + key);
        }
        return optionalInt(params, key, 0);
    }

    public static int optionalInt(Map<String, Object> params, String key, int fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer", e);
        }
    }

    public static List<Integer> intList(Map<String, Object> params, String key, List<Integer> fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        List<Integer> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                result.add(optionalInt(Map.of(key, item), key, 0));
            }
        } else {
            result.add(optionalInt(params, key, 0));
        }
        return List.copyOf(result);
    }

    public static List<String> stringList(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    public static Map<String, String> stringMap(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), String.valueOf(v)));
        return result;
    }
}
