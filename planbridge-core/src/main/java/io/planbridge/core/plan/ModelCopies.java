package io.planbridge.core.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Defensive copies for the model records.
///
/// `Map.copyOf` would lose the document order of variables and artifacts and rejects
/// null values that decoded JSON may contain, so maps are copied into unmodifiable
/// {@link LinkedHashMap}s instead.
final class ModelCopies {

    private ModelCopies() {}

    static <K, V> Map<K, V> orderedMap(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static <T> List<T> list(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
