package io.planbridge.core.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A response that arrived as a decoded record or as a JSON object.
///
/// Planning responses carry a completion flag and control instructions for the engine
/// (`targetAchieved`, `transition`, `context_update`); streaming roles in
/// non-streaming mode return an `actions` list. The content is passed through unchanged.
///
/// @param content decoded content in wire order, not null
public record StructuredPayload(Map<String, Object> content) implements PlanPayload {

    public StructuredPayload {
        Objects.requireNonNull(content, "content must not be null");
        content = ModelCopies.orderedMap(content);
    }

    @Override
    public ResponseKind kind() {
        return content.get("actions") instanceof List<?> ? ResponseKind.ACTIONS : ResponseKind.JSON;
    }

    /// Returns the completion flag.
    ///
    /// Read from `targetAchieved`, then `target_achieved`, then
    /// `transition.target_achieved`. String values `"true"` and `"false"` are
    /// accepted.
    ///
    /// @return flag, empty if the response carries none
    public Optional<Boolean> targetAchieved() {
        Optional<Boolean> flag = flag(content.get("targetAchieved"));
        if (flag.isEmpty()) {
            flag = flag(content.get("target_achieved"));
        }
        if (flag.isEmpty() && content.get("transition") instanceof Map<?, ?> transition) {
            flag = flag(transition.get("target_achieved"));
        }
        return flag;
    }

    private static Optional<Boolean> flag(Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof String s) {
            return Optional.of(Boolean.parseBoolean(s.trim()));
        }
        return Optional.empty();
    }

    public Optional<Object> transition() {
        return Optional.ofNullable(content.get("transition"));
    }

    public Map<String, Object> contextUpdate() {
        Object value = content.get("context_update");
        if (value instanceof Map<?, ?> map) {
            return Collections.unmodifiableMap(stringKeyed(map));
        }
        return Map.of();
    }

    /// Returns the entries of the `actions` list that are records, in order.
    ///
    /// @return action records, empty if the payload carries none
    public List<ActionRecord> actions() {
        if (!(content.get("actions") instanceof List<?> raw)) {
            return List.of();
        }
        List<ActionRecord> actions = new ArrayList<>();
        for (Object item : raw) {
            if (item instanceof Map<?, ?> map) {
                actions.add(new ActionRecord(stringKeyed(map)));
            }
        }
        return List.copyOf(actions);
    }

    /// Copies the entries of a decoded record, dropping any entry whose key is not text.
    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() instanceof String key) {
                copy.put(key, entry.getValue());
            }
        }
        return copy;
    }
}
