package io.planbridge.core.dispatch;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A request ready for a {@link BackendTransport}, with the location already resolved.
///
/// @param role backend role, not null
/// @param state engine state record, not null
/// @param location resolved execution location, not null
/// @param stream whether actions should be streamed
/// @param priorFeedback feedback from the previous behavior, may be null
/// @param notebookId notebook identifier, may be null
public record BackendRequest(
        HandlerRole role,
        Map<String, Object> state,
        ExecutionLocation location,
        boolean stream,
        Map<String, Object> priorFeedback,
        String notebookId) {

    public BackendRequest {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    public Optional<Map<String, Object>> feedback() {
        return Optional.ofNullable(priorFeedback);
    }

    public Optional<String> notebook() {
        return Optional.ofNullable(notebookId);
    }
}
