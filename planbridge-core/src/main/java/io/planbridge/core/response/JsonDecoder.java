package io.planbridge.core.response;

import java.util.Map;

/// Decodes a JSON object from text.
///
/// The core has no JSON library; the serialization module provides the Jackson-backed
/// implementation.
@FunctionalInterface
public interface JsonDecoder {

    /// Decodes the text as a JSON object.
    ///
    /// @param text candidate JSON, not null
    /// @return decoded fields in document order, never null
    /// @throws JsonDecodingException if the text is not a JSON object
    Map<String, Object> decode(String text) throws JsonDecodingException;
}
