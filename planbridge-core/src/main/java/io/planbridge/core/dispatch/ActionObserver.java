package io.planbridge.core.dispatch;

import io.planbridge.core.plan.ActionRecord;

/// Hook called for every action a streaming handler forwards.
@FunctionalInterface
public interface ActionObserver {

    /// Called before the action is handed to the consumer.
    ///
    /// @param role role of the handler
    /// @param sequence 1-based position of the action in its stream
    /// @param action the action
    void onAction(HandlerRole role, int sequence, ActionRecord action);

    static ActionObserver none() {
        return (role, sequence, action) -> {};
    }
}
