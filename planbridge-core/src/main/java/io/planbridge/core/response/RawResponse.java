package io.planbridge.core.response;

import java.util.Map;
import java.util.Objects;

/// A backend response before classification.
///
/// Transports that already decoded a JSON body hand over a {@link Structured} record;
/// everything else, markup or an undecoded JSON string, arrives as {@link Text}.
public sealed interface RawResponse permits RawResponse.Structured, RawResponse.Text {

    static RawResponse structured(Map<String, Object> content) {
        return new Structured(content);
    }

    static RawResponse text(String body) {
        return new Text(body);
    }

    /// An already-decoded record.
    ///
    /// @param content decoded fields, not null
    record Structured(Map<String, Object> content) implements RawResponse {
        public Structured {
            Objects.requireNonNull(content, "content must not be null");
        }
    }

    /// An unclassified response body.
    ///
    /// @param body raw body, not null
    record Text(String body) implements RawResponse {
        public Text {
            Objects.requireNonNull(body, "body must not be null");
        }
    }
}
