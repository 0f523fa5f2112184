package io.planbridge.core.markup;

import java.util.Objects;

/// One closing tag rewritten by the {@link TagRepairEngine}.
///
/// @param line 1-based line of the rewritten tag
/// @param foundTag name the backend used
/// @param expectedTag name of the element that was actually open
public record RepairLogEntry(int line, String foundTag, String expectedTag) {

    public RepairLogEntry {
        Objects.requireNonNull(foundTag, "foundTag must not be null");
        Objects.requireNonNull(expectedTag, "expectedTag must not be null");
    }
}
