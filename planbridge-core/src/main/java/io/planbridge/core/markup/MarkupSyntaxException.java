package io.planbridge.core.markup;

import java.io.Serial;
import java.util.Objects;

/// Thrown when markup cannot be turned into a tree.
///
/// The message has the form `"<description>: line N, column M"`; the diagnostic report
/// reads the location back from it.
public class MarkupSyntaxException extends Exception {

    @Serial private static final long serialVersionUID = 7742183015905437716L;

    /// Why parsing stopped.
    public enum Reason {
        /// Input ended before the document was complete ("no element found").
        END_OF_INPUT,
        /// Any other defect.
        MALFORMED
    }

    private final Reason reason;
    private final int line;
    private final int column;

    public MarkupSyntaxException(Reason reason, String description, int line, int column) {
        super(description + ": line " + line + ", column " + column);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.line = line;
        this.column = column;
    }

    public Reason reason() {
        return reason;
    }

    public boolean isEndOfInput() {
        return reason == Reason.END_OF_INPUT;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
