package io.planbridge.core.dispatch;

import io.planbridge.core.response.ParseOutcome;

/// Typed facade over one backend role.
///
/// Implementations resolve the execution location before touching the transport and keep
/// no state between invocations. Transport failures are logged and rethrown unchanged.
///
/// @see PlanningHandler
/// @see GeneratingHandler
/// @see ReflectingHandler
public interface ResponseHandler {

    HandlerRole role();

    /// Performs one request and parses the complete response.
    ///
    /// @param call invocation arguments, not null
    /// @return parse outcome, never null
    /// @throws BackendException if the transport fails
    ParseOutcome call(HandlerCall call);

    /// Opens a lazy action stream.
    ///
    /// @param call invocation arguments, not null
    /// @return open stream that the caller must close, never null
    /// @throws BackendException if the transport fails to open the stream
    /// @throws UnsupportedOperationException if the role does not stream
    ActionStream stream(HandlerCall call);
}
