package io.planbridge.core.dispatch;

import java.io.Serial;

/// Thrown by a {@link BackendTransport} when a backend call fails.
public class BackendException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5530893014475517306L;

    private final int statusCode;

    public BackendException(String message) {
        this(message, -1, null);
    }

    public BackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /// Returns the HTTP-style status code reported by the backend.
    ///
    /// @return status code, -1 if the call failed before a status was received
    public int statusCode() {
        return statusCode;
    }
}
