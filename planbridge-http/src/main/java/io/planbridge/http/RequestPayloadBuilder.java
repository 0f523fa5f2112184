package io.planbridge.http;

import io.planbridge.core.dispatch.BackendRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Builds the JSON request body for a backend call.
///
/// Engine state normally arrives already split into `observation` and `state`;
/// both are forwarded as is. Older engines hand over a flat record with a `progress_info`
/// location instead, which is reshaped into the same structure. Either way the body ends with
/// `options.stream`, and with `behavior_feedback` and `notebook_id` when the
/// request carries them.
final class RequestPayloadBuilder {

    private RequestPayloadBuilder() {}

    /// Builds the request body.
    ///
    /// @param request resolved backend request, not null
    /// @return body fields in wire order, never null
    /// @throws IllegalArgumentException if the state has neither `observation` and
    ///     `state` nor `progress_info`
    static Map<String, Object> build(BackendRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Map<String, Object> state = request.state();
        Map<String, Object> payload = new LinkedHashMap<>();

        if (state.containsKey("observation") && state.containsKey("state")) {
            payload.put("observation", state.get("observation"));
            payload.put("state", state.get("state"));
        } else {
            Object progressInfo = state.get("progress_info");
            if (isEmpty(progressInfo)) {
                throw new IllegalArgumentException(
                        "Missing required 'progress_info' or 'observation' in state");
            }
            payload.put("observation", Map.of("location", progressInfo));
            payload.put("state", legacyState(state));
        }

        payload.put("options", Map.of("stream", request.stream()));
        request.feedback()
                .filter(feedback -> !feedback.isEmpty())
                .ifPresent(feedback -> payload.put("behavior_feedback", feedback));
        request.notebook()
                .filter(id -> !id.isBlank())
                .ifPresent(id -> payload.put("notebook_id", id));
        return payload;
    }

    private static Map<String, Object> legacyState(Map<String, Object> state) {
        Map<String, Object> reshaped = new LinkedHashMap<>();
        reshaped.put("variables", state.getOrDefault("variables", Map.of()));
        reshaped.put(
                "effects",
                state.getOrDefault("effects", Map.of("current", List.of(), "history", List.of())));
        reshaped.put("notebook", state.getOrDefault("notebook", Map.of()));
        reshaped.put("FSM", state.getOrDefault("FSM", Map.of()));
        return reshaped;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value instanceof String text && text.isBlank();
    }
}
