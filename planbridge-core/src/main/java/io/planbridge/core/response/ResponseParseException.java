package io.planbridge.core.response;

import java.io.Serial;
import java.util.Objects;

/// Thrown when a caller unwraps a failed {@link ParseOutcome}.
///
/// @see ParseOutcome#payloadOrThrow()
public class ResponseParseException extends Exception {

    @Serial private static final long serialVersionUID = 4127739085616213904L;

    private final transient ParseError error;

    public ResponseParseException(ParseError error) {
        super(describe(error));
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    private static String describe(ParseError error) {
        Objects.requireNonNull(error, "error must not be null");
        return switch (error.kind()) {
            case UNCLASSIFIABLE ->
                    "Unclassifiable response: " + error.message() + " [preview: " + error.preview() + "]";
            case STRUCTURAL -> "Malformed response markup: " + error.message();
        };
    }
}
