package io.planbridge.core.plan;

/// Sealed union of everything a backend response can be parsed into.
///
/// Markup responses map to {@link ParsedWorkflow}, {@link StepPlan}, {@link Behavior} or
/// {@link Reflection} depending on their root tag, unknown roots to {@link EmptyPayload}.
/// Records and JSON strings become a {@link StructuredPayload}.
///
/// Callers dispatch on {@link #kind()} or with `instanceof`:
///
/// {@snippet :
/// PlanPayload payload = outcome.isRecovered()
///         ? outcome.payloadAcceptingRecovery()
///         : outcome.payloadOrThrow();
/// if (payload instanceof ParsedWorkflow workflow) {
///     engine.replaceStages(workflow.stages());
/// } else if (payload instanceof StepPlan plan) {
///     engine.replaceSteps(plan.steps());
/// }
/// }
///
/// @see io.planbridge.core.response.ParseOutcome for the wrapper carrying recovery state
public sealed interface PlanPayload
        permits ParsedWorkflow,
                StepPlan,
                Behavior,
                Reflection,
                StructuredPayload,
                EmptyPayload {

    /// Returns the classification of this payload.
    ///
    /// @return payload kind, never null
    ResponseKind kind();
}
