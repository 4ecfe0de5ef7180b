package org.calista.accuracy.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the open string-keyed maps used as the serialization boundary.
 *
 * <p>Absent and {@code null} are the same thing here ("structurally absent");
 * a present value of the wrong shape is reported by the caller as invalid.
 */
public final class Maps {

    private Maps() {}

    public static boolean isPresent(Map<String, ?> map, String key) {
        return map != null && map.get(key) != null;
    }

    /** Immutable insertion-ordered copy with {@link String} keys; {@code null} becomes empty. */
    public static Map<String, Object> copyOf(Map<?, ?> source) {
        if (source == null || source.isEmpty()) return Map.of();
        LinkedHashMap<String, Object> m = new LinkedHashMap<>(source.size() * 2);
        for (Map.Entry<?, ?> e : source.entrySet()) {
            if (e.getKey() == null) continue;
            m.put(String.valueOf(e.getKey()), e.getValue());
        }
        return Collections.unmodifiableMap(m);
    }

    /** Copy-on-write put. {@code null} value removes the key. */
    public static Map<String, Object> with(Map<String, Object> source, String key, Object value) {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>(source == null ? Map.of() : source);
        if (key != null && !key.isBlank()) {
            if (value == null) m.remove(key);
            else m.put(key, value);
        }
        return Collections.unmodifiableMap(m);
    }

    /** Puts only when the value is non-null and not an empty map. */
    public static void putIfMeaningful(Map<String, Object> target, String key, Object value) {
        if (value == null) return;
        if (value instanceof Map<?, ?> m && m.isEmpty()) return;
        target.put(key, value);
    }

    /**
     * @return the map value as a string-keyed map, or {@code null} when the value is not a map
     */
    public static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> m)) return null;
        return copyOf(m);
    }

    public static boolean isFiniteNumber(Object value) {
        return value instanceof Number n && Double.isFinite(n.doubleValue());
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }
}
