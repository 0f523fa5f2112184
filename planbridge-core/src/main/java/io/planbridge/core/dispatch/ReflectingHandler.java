package io.planbridge.core.dispatch;

import io.planbridge.core.response.ParseOutcome;
import io.planbridge.core.response.ResponseParser;
import java.util.Objects;

/// Streams commentary and follow-up actions after a behavior completes.
///
/// @param transport backend transport, not null
/// @param parser parser for non-streaming calls, not null
/// @param observer per-action hook, not null
public record ReflectingHandler(
        BackendTransport transport, ResponseParser parser, ActionObserver observer)
        implements ResponseHandler {

    public ReflectingHandler {
        Objects.requireNonNull(transport, "transport must not be null");
        Objects.requireNonNull(parser, "parser must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
    }

    public ReflectingHandler(BackendTransport transport, ResponseParser parser) {
        this(transport, parser, ActionObserver.none());
    }

    @Override
    public HandlerRole role() {
        return HandlerRole.REFLECTING;
    }

    /// Non-streaming variant; the backend usually answers with a `<reflection>` document.
    @Override
    public ParseOutcome call(HandlerCall call) {
        return HandlerSupport.query(role(), transport, parser, call);
    }

    @Override
    public ActionStream stream(HandlerCall call) {
        return HandlerSupport.stream(role(), transport, observer, call);
    }
}
