package io.planbridge.core.diagnostics;

/// Receives reports of markup the parser could neither parse nor recover.
///
/// Implementations must not throw: a failing sink must never turn a parse failure into a
/// different error.
///
/// @see FileDiagnosticSink
@FunctionalInterface
public interface DiagnosticSink {

    /// Records one failure.
    ///
    /// @param report failure details, not null
    void report(ParseFailureReport report);

    /// Returns a sink that discards every report.
    static DiagnosticSink none() {
        return report -> {};
    }
}
