package io.planbridge.core.plan;

import java.util.List;

/// Stage list proposed by the planning backend, with optional notebook title and description.
///
/// Produced by a `<workflow>` root (title and description wrapped around a
/// `<stages>` element) and by a bare `<stages>` root. Both historical wire formats
/// for the stage list, a `<remaining>` wrapper and bare repeated `<stage>` siblings,
/// end up here in document order.
///
/// @param title notebook title, null if absent
/// @param description notebook description, null if absent
/// @param focus what the backend wants the engine to concentrate on next, null if absent
/// @param stages stages in document order, not null, may be empty
public record ParsedWorkflow(String title, String description, String focus, List<Stage> stages)
        implements PlanPayload {

    public ParsedWorkflow {
        title = ModelCopies.blankToNull(title);
        description = ModelCopies.blankToNull(description);
        focus = ModelCopies.blankToNull(focus);
        stages = ModelCopies.list(stages);
    }

    public static ParsedWorkflow ofStages(List<Stage> stages) {
        return new ParsedWorkflow(null, null, null, stages);
    }

    @Override
    public ResponseKind kind() {
        return ResponseKind.STAGES;
    }
}
