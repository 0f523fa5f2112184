package io.planbridge.core.plan;

import java.util.List;

/// Step list for the current stage, from a `<steps>` root.
///
/// @param focus focus text, null if absent
/// @param goals overall goals text, null if absent
/// @param steps steps in document order, not null, may be empty
public record StepPlan(String focus, String goals, List<Step> steps) implements PlanPayload {

    public StepPlan {
        focus = ModelCopies.blankToNull(focus);
        goals = ModelCopies.blankToNull(goals);
        steps = ModelCopies.list(steps);
    }

    @Override
    public ResponseKind kind() {
        return ResponseKind.STEPS;
    }
}
