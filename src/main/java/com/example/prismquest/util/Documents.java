package com.example.prismquest.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for parsed YAML/JSON documents ({@code Map<String, Object>} trees).
 * Missing or mistyped values fall back to the supplied default.
 */
public final class Documents {

    private Documents() {
    }

    public static String getString(Map<String, Object> map, String key, String def) {
        if (map == null) return def;
        Object val = map.get(key);
        return val != null ? val.toString() : def;
    }

    public static int getInt(Map<String, Object> map, String key, int def) {
        if (map == null) return def;
        Object val = map.get(key);
        if (val instanceof Number number) return number.intValue();
        if (val instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    public static double getDouble(Map<String, Object> map, String key, double def) {
        if (map == null) return def;
        Object val = map.get(key);
        if (val instanceof Number number) return number.doubleValue();
        if (val instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    public static boolean getBoolean(Map<String, Object> map, String key, boolean def) {
        if (map == null) return def;
        Object val = map.get(key);
        if (val instanceof Boolean b) return b;
        if (val instanceof String s) return Boolean.parseBoolean(s.trim());
        if (val instanceof Number number) return number.intValue() != 0;
        return def;
    }

    /**
     * Nested map under {@code key}, or null when absent or not a map.
     */
    public static Map<String, Object> getMap(Map<String, Object> map, String key) {
        if (map == null) return null;
        Object val = map.get(key);
        if (val instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        return null;
    }

    /**
     * List of nested maps under {@code key}; non-map elements are skipped.
     */
    public static List<Map<String, Object>> getMapList(Map<String, Object> map, String key) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (map == null) return out;
        Object val = map.get(key);
        if (val instanceof List<?> list) {
            for (Object o : list) {
                Map<String, Object> m = asMap(o);
                if (m != null) out.add(m);
            }
        }
        return out;
    }

    /**
     * List of strings under {@code key}. A single scalar becomes a one-element list.
     * Returns null when the key is absent.
     */
    public static List<String> getStringList(Map<String, Object> map, String key) {
        if (map == null || !map.containsKey(key) || map.get(key) == null) return null;
        Object val = map.get(key);
        List<String> out = new ArrayList<>();
        if (val instanceof List<?> list) {
            for (Object o : list) out.add(o != null ? o.toString() : "");
        } else {
            out.add(val.toString());
        }
        return out;
    }

    public static Map<String, Object> asMap(Object o) {
        if (o instanceof Map<?, ?> m) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                out.put(String.valueOf(e.getKey()), e.getValue());
            }
            return out;
        }
        return null;
    }
}
