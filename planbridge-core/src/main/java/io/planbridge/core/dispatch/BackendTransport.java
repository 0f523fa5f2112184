package io.planbridge.core.dispatch;

import io.planbridge.core.response.RawResponse;

/// Moves requests to the backend and responses back.
///
/// Implementations report failures as {@link BackendException}. They do not retry.
public interface BackendTransport {

    /// Sends a request and waits for the complete response.
    ///
    /// @param request request, not null
    /// @return raw response, never null
    /// @throws BackendException if the backend cannot be reached or answers with an error
    RawResponse query(BackendRequest request);

    /// Opens a lazy stream of actions.
    ///
    /// The returned stream must release every transport resource when closed, including when
    /// the consumer stops before the end.
    ///
    /// @param request request, not null
    /// @return open action stream, never null
    /// @throws BackendException if the stream cannot be opened
    ActionStream openStream(BackendRequest request);
}
