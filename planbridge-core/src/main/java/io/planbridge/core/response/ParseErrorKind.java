package io.planbridge.core.response;

/// Category of a parse failure.
public enum ParseErrorKind {
    /// Input is neither a record, markup, nor a JSON object.
    UNCLASSIFIABLE,
    /// Markup that could not be parsed and could not be recovered.
    STRUCTURAL
}
