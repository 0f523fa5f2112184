package io.planbridge.core.plan;

/// Classification of a parsed backend response.
public enum ResponseKind {
    /// Stage list, from a `<workflow>` or `<stages>` root.
    STAGES,
    /// Step list, from a `<steps>` root.
    STEPS,
    /// Single behavior definition.
    BEHAVIOR,
    /// Reflection on a completed behavior.
    REFLECTION,
    /// Decoded record carrying an `actions` list.
    ACTIONS,
    /// Any other decoded record.
    JSON,
    /// Markup with an unknown root tag.
    EMPTY
}
