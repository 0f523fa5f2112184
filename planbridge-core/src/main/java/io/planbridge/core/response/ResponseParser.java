package io.planbridge.core.response;

import io.planbridge.core.markup.MarkupParser;
import io.planbridge.core.plan.StructuredPayload;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for turning a backend response into a {@link ParseOutcome}.
///
/// Classification:
///
/// - an already-decoded record passes through unchanged as a {@link StructuredPayload}
/// - text starting with `<` after trimming goes through the {@link MarkupParser}
/// - any other text must decode as a JSON object, otherwise the outcome is
///   {@link ParseErrorKind#UNCLASSIFIABLE} with a preview of the input
///
/// Stateless and thread-safe.
public final class ResponseParser {

    private static final Logger LOG = Logger.getLogger(ResponseParser.class.getName());

    private final MarkupParser markupParser;
    private final JsonDecoder jsonDecoder;
    private final int previewLength;

    public ResponseParser(MarkupParser markupParser, JsonDecoder jsonDecoder, int previewLength) {
        this.markupParser = Objects.requireNonNull(markupParser, "markupParser must not be null");
        this.jsonDecoder = Objects.requireNonNull(jsonDecoder, "jsonDecoder must not be null");
        if (previewLength <= 0) {
            throw new IllegalArgumentException("previewLength must be positive");
        }
        this.previewLength = previewLength;
    }

    public ResponseParser(MarkupParser markupParser, JsonDecoder jsonDecoder) {
        this(markupParser, jsonDecoder, ParseError.DEFAULT_PREVIEW_LENGTH);
    }

    /// Classifies and parses a response.
    ///
    /// @param response raw response, not null
    /// @return outcome, never null
    public ParseOutcome parse(RawResponse response) {
        Objects.requireNonNull(response, "response must not be null");
        if (response instanceof RawResponse.Structured structured) {
            return ParseOutcome.ok(new StructuredPayload(structured.content()));
        }
        return parseText(((RawResponse.Text) response).body());
    }

    public ParseOutcome parse(String text) {
        return parse(RawResponse.text(text));
    }

    public ParseOutcome parse(Map<String, Object> record) {
        return parse(RawResponse.structured(record));
    }

    private ParseOutcome parseText(String body) {
        String text = body.strip();
        if (text.startsWith("<")) {
            return markupParser.parse(text);
        }
        try {
            return ParseOutcome.ok(new StructuredPayload(jsonDecoder.decode(text)));
        } catch (JsonDecodingException e) {
            String preview = ParseError.preview(text, previewLength);
            LOG.severe("Failed to parse response: " + preview);
            return ParseOutcome.failed(
                    ParseError.unclassifiable(
                            "Cannot parse response as markup or JSON: " + e.getMessage(),
                            text,
                            previewLength));
        }
    }
}
