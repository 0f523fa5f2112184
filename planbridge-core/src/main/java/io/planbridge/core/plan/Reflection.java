package io.planbridge.core.plan;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Post-behavior evaluation from a `<reflection>` root.
///
/// Tells the engine whether the behavior finished, which state to move to, and what the
/// behavior left behind for the next one.
///
/// @param behaviorComplete whether the current behavior is complete
/// @param nextState target engine state, null if the backend made no decision
/// @param variablesProduced variables the behavior produced, name to value
/// @param artifactsProduced artifacts evaluated by the backend, in document order
/// @param outputsTracking produced / in-progress / remaining output bookkeeping
/// @param whatHappened narrative keyed by element name (`overview`, `key_findings`)
/// @param recommendations advice for the next behavior keyed by element name
public record Reflection(
        boolean behaviorComplete,
        String nextState,
        Map<String, String> variablesProduced,
        List<ArtifactStatus> artifactsProduced,
        OutputsTracking outputsTracking,
        Map<String, String> whatHappened,
        Map<String, String> recommendations)
        implements PlanPayload {

    public Reflection {
        nextState = ModelCopies.blankToNull(nextState);
        variablesProduced = ModelCopies.orderedMap(variablesProduced);
        artifactsProduced = ModelCopies.list(artifactsProduced);
        outputsTracking = outputsTracking != null ? outputsTracking : OutputsTracking.empty();
        whatHappened = ModelCopies.orderedMap(whatHappened);
        recommendations = ModelCopies.orderedMap(recommendations);
    }

    @Override
    public ResponseKind kind() {
        return ResponseKind.REFLECTION;
    }

    /// Evaluation status of one artifact.
    ///
    /// @param name artifact name, not null
    /// @param status status reported by the backend, `unknown` if absent
    public record ArtifactStatus(String name, String status) {
        public ArtifactStatus {
            Objects.requireNonNull(name, "name must not be null");
            status = status == null || status.isBlank() ? "unknown" : status;
        }
    }

    /// Output bookkeeping after a behavior.
    ///
    /// @param produced artifacts already produced
    /// @param inProgress artifacts being worked on
    /// @param remaining artifacts not yet started
    public record OutputsTracking(
            List<String> produced, List<String> inProgress, List<String> remaining) {

        public OutputsTracking {
            produced = ModelCopies.list(produced);
            inProgress = ModelCopies.list(inProgress);
            remaining = ModelCopies.list(remaining);
        }

        public static OutputsTracking empty() {
            return new OutputsTracking(List.of(), List.of(), List.of());
        }
    }
}
