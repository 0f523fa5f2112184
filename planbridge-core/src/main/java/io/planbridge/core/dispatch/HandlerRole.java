package io.planbridge.core.dispatch;

/// The three backend roles and their endpoint names.
public enum HandlerRole {
    /// One-shot planning query.
    PLANNING("planning"),
    /// Forward action stream for the current behavior.
    GENERATING("generating"),
    /// Post-completion commentary and actions.
    REFLECTING("reflecting");

    private final String endpoint;

    HandlerRole(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }
}
