package io.planbridge.core.dispatch;

import io.planbridge.core.response.ParseOutcome;
import io.planbridge.core.response.RawResponse;
import io.planbridge.core.response.ResponseParser;
import java.util.Objects;
import java.util.logging.Logger;

/// Location resolution, logging and error propagation shared by the three handlers.
final class HandlerSupport {

    private static final Logger LOG = Logger.getLogger(HandlerSupport.class.getName());

    private HandlerSupport() {}

    static BackendRequest request(HandlerRole role, HandlerCall call, boolean stream) {
        Objects.requireNonNull(call, "call must not be null");
        ExecutionLocation location =
                ExecutionLocation.resolve(call.state(), call.stageId(), call.stepId());
        LOG.info(
                "["
                        + role
                        + "] Calling "
                        + role.endpoint()
                        + " (stage="
                        + location.stageId()
                        + ", step="
                        + location.stepId()
                        + ", stream="
                        + stream
                        + ")");
        return new BackendRequest(
                role, call.state(), location, stream, call.priorFeedback(), call.notebookId());
    }

    static ParseOutcome query(
            HandlerRole role, BackendTransport transport, ResponseParser parser, HandlerCall call) {
        BackendRequest request = request(role, call, false);
        RawResponse response;
        try {
            response = transport.query(request);
        } catch (RuntimeException e) {
            LOG.severe("[" + role + "] Backend call failed: " + e.getMessage());
            throw e;
        }
        ParseOutcome outcome = parser.parse(response);
        if (outcome instanceof ParseOutcome.Failed failed) {
            LOG.severe("[" + role + "] Response could not be parsed: " + failed.error().message());
        } else if (outcome.isRecovered()) {
            LOG.warning("[" + role + "] " + outcome.recoveryWarning().orElse(ParseOutcome.RECOVERY_WARNING));
        } else {
            LOG.info("[" + role + "] Parsed response");
        }
        return outcome;
    }

    static ActionStream stream(
            HandlerRole role, BackendTransport transport, ActionObserver observer, HandlerCall call) {
        BackendRequest request = request(role, call, true);
        ActionStream source;
        try {
            source = transport.openStream(request);
        } catch (RuntimeException e) {
            LOG.severe("[" + role + "] Backend stream failed to open: " + e.getMessage());
            throw e;
        }
        return new ObservedActionStream(role, source, observer);
    }
}
