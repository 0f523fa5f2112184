package io.planbridge.core.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Arguments of one handler invocation.
///
/// {@snippet :
/// HandlerCall call = HandlerCall.of(state)
///         .atLocation("stage-2", "step-1")
///         .withPriorFeedback(feedback);
/// }
///
/// @param state engine state record, not null
/// @param stageId explicit stage id, null to read it from the state
/// @param stepId explicit step id, null to read it from the state
/// @param priorFeedback feedback from the previous behavior, may be null
/// @param notebookId notebook identifier, may be null
public record HandlerCall(
        Map<String, Object> state,
        String stageId,
        String stepId,
        Map<String, Object> priorFeedback,
        String notebookId) {

    public HandlerCall {
        Objects.requireNonNull(state, "state must not be null");
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        priorFeedback =
                priorFeedback != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(priorFeedback))
                        : null;
    }

    public static HandlerCall of(Map<String, Object> state) {
        return new HandlerCall(state, null, null, null, null);
    }

    public HandlerCall atLocation(String stageId, String stepId) {
        return new HandlerCall(state, stageId, stepId, priorFeedback, notebookId);
    }

    public HandlerCall withPriorFeedback(Map<String, Object> priorFeedback) {
        return new HandlerCall(state, stageId, stepId, priorFeedback, notebookId);
    }

    public HandlerCall withNotebookId(String notebookId) {
        return new HandlerCall(state, stageId, stepId, priorFeedback, notebookId);
    }
}
