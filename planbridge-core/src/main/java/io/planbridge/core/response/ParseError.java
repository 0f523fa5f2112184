package io.planbridge.core.response;

import java.util.Objects;

/// Details of a failed parse.
///
/// @param kind failure category, not null
/// @param message parser message, not null
/// @param line 1-based line of the defect, 0 when unknown
/// @param column 1-based column of the defect, 0 when unknown
/// @param preview leading characters of the offending input, not null
public record ParseError(ParseErrorKind kind, String message, int line, int column, String preview) {

    /// Length of {@link #preview()} unless configured otherwise.
    public static final int DEFAULT_PREVIEW_LENGTH = 100;

    public ParseError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
        preview = preview != null ? preview : "";
    }

    public static ParseError unclassifiable(String message, String input, int previewLength) {
        return new ParseError(
                ParseErrorKind.UNCLASSIFIABLE, message, 0, 0, preview(input, previewLength));
    }

    public static ParseError structural(
            String message, int line, int column, String input, int previewLength) {
        return new ParseError(
                ParseErrorKind.STRUCTURAL, message, line, column, preview(input, previewLength));
    }

    /// Returns the first `length` characters of the input.
    ///
    /// @param input input text, may be null
    /// @param length maximum preview length
    /// @return preview, never null
    public static String preview(String input, int length) {
        if (input == null) {
            return "";
        }
        return input.length() <= length ? input : input.substring(0, length);
    }

    public boolean hasLocation() {
        return line > 0;
    }
}
