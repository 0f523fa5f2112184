package io.planbridge.core.dispatch;

import io.planbridge.core.response.ParseOutcome;
import io.planbridge.core.response.ResponseParser;
import java.util.Objects;

/// One-shot planning query.
///
/// The response arrives as a record or as markup and is routed through the
/// {@link ResponseParser}; a recovered outcome keeps its flag all the way to the caller.
///
/// @param transport backend transport, not null
/// @param parser response parser, not null
public record PlanningHandler(BackendTransport transport, ResponseParser parser)
        implements ResponseHandler {

    public PlanningHandler {
        Objects.requireNonNull(transport, "transport must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public HandlerRole role() {
        return HandlerRole.PLANNING;
    }

    @Override
    public ParseOutcome call(HandlerCall call) {
        return HandlerSupport.query(role(), transport, parser, call);
    }

    /// Planning does not stream.
    @Override
    public ActionStream stream(HandlerCall call) {
        throw new UnsupportedOperationException("Planning handler does not stream actions");
    }
}
