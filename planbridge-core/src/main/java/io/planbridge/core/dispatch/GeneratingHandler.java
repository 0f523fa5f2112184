package io.planbridge.core.dispatch;

import io.planbridge.core.response.ParseOutcome;
import io.planbridge.core.response.ResponseParser;
import java.util.Objects;

/// Streams the actions that carry out the current behavior.
///
/// @param transport backend transport, not null
/// @param parser parser for non-streaming calls, not null
/// @param observer per-action hook, not null
public record GeneratingHandler(
        BackendTransport transport, ResponseParser parser, ActionObserver observer)
        implements ResponseHandler {

    public GeneratingHandler {
        Objects.requireNonNull(transport, "transport must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
    }

    public GeneratingHandler(BackendTransport transport, ResponseParser parser) {
        this(transport, parser, ActionObserver.none());
    }

    @Override
    public HandlerRole role() {
        return HandlerRole.GENERATING;
    }

    /// Non-streaming variant: the whole `actions` list in one response.
    @Override
    public ParseOutcome call(HandlerCall call) {
        return HandlerSupport.query(role(), transport, parser, call);
    }

    @Override
    public ActionStream stream(HandlerCall call) {
        return HandlerSupport.stream(role(), transport, observer, call);
    }
}
