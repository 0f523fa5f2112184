package io.planbridge.core.response;

import java.io.Serial;

/// Thrown by a {@link JsonDecoder} when text is not a JSON object.
public class JsonDecodingException extends Exception {

    @Serial private static final long serialVersionUID = -2290843557261190473L;

    public JsonDecodingException(String message) {
        super(message);
    }

    public JsonDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
