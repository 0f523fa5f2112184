package io.planbridge.core.plan;

import java.util.Objects;

/// Result for well-formed markup whose root the mapper does not know.
///
/// Unknown roots are informational: the caller gets an empty payload and a warning instead
/// of a failure.
///
/// @param rootTag name of the unrecognized root element, not null
public record EmptyPayload(String rootTag) implements PlanPayload {

    public EmptyPayload {
        Objects.requireNonNull(rootTag, "rootTag must not be null");
    }

    public String warning() {
        return "Unknown root tag: " + rootTag;
    }

    @Override
    public ResponseKind kind() {
        return ResponseKind.EMPTY;
    }
}
