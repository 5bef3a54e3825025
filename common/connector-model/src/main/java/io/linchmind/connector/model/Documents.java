package io.linchmind.connector.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies opaque JSON-like documents. Unlike {@link Map#copyOf(Map)} these keep {@code null}
 * values, which are legal in connector configuration.
 */
public final class Documents {

    private Documents() {
    }

    public static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    /**
     * Shallow merge where entries of {@code overlay} win.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overlay != null) {
            merged.putAll(overlay);
        }
        return Collections.unmodifiableMap(merged);
    }
}
