package io.planbridge.core.diagnostics;

import java.util.Objects;

/// Everything needed to diagnose one unrecoverable markup failure.
///
/// @param errorType short name of the failure type, not null
/// @param errorMessage parser message ending in `line N, column M`, not null
/// @param parsedText text the parser actually saw, after sanitizing and tag repair, not null
/// @param originalInput response body as received, not null
public record ParseFailureReport(
        String errorType, String errorMessage, String parsedText, String originalInput) {

    public ParseFailureReport {
        Objects.requireNonNull(errorType, "errorType must not be null");
        Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        Objects.requireNonNull(parsedText, "parsedText must not be null");
        Objects.requireNonNull(originalInput, "originalInput must not be null");
    }
}
