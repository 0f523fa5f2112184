package io.planbridge.core.dispatch;

import java.util.Map;
import java.util.Objects;

/// Where the engine currently is: stage and step.
///
/// Callers may pass the ids explicitly; missing ids are read from
/// `observation.location.current.{stage_id, step_id}` in the state record and default to
/// {@value #UNKNOWN_STAGE} and {@value #NO_STEP}.
///
/// @param stageId current stage id, not null
/// @param stepId current step id, not null
public record ExecutionLocation(String stageId, String stepId) {

    public static final String UNKNOWN_STAGE = "unknown";
    public static final String NO_STEP = "none";

    public ExecutionLocation {
        Objects.requireNonNull(stageId, "stageId must not be null");
        Objects.requireNonNull(stepId, "stepId must not be null");
    }

    /// Resolves the location, filling only the ids the caller did not give.
    ///
    /// @param state engine state record, may be null
    /// @param stageId explicit stage id, may be null
    /// @param stepId explicit step id, may be null
    /// @return resolved location, never null
    public static ExecutionLocation resolve(Map<String, Object> state, String stageId, String stepId) {
        if (stageId != null && stepId != null) {
            return new ExecutionLocation(stageId, stepId);
        }
        Map<?, ?> current = nested(state, "observation", "location", "current");
        return new ExecutionLocation(
                stageId != null ? stageId : text(current.get("stage_id"), UNKNOWN_STAGE),
                stepId != null ? stepId : text(current.get("step_id"), NO_STEP));
    }

    private static Map<?, ?> nested(Map<?, ?> root, String... path) {
        Map<?, ?> node = root != null ? root : Map.of();
        for (String key : path) {
            Object child = node.get(key);
            if (!(child instanceof Map<?, ?> map)) {
                return Map.of();
            }
            node = map;
        }
        return node;
    }

    private static String text(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }
}
