package io.planbridge.core.dispatch;

import io.planbridge.core.plan.ActionRecord;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/// Forwards a transport stream one action at a time, logging each action and passing it to the
/// {@link ActionObserver}. A transport error ends the stream, closes the source and propagates.
final class ObservedActionStream implements ActionStream {

    private static final Logger LOG = Logger.getLogger(ObservedActionStream.class.getName());

    private final HandlerRole role;
    private final ActionStream source;
    private final ActionObserver observer;
    private int count;
    private boolean exhausted;
    private boolean closed;

    ObservedActionStream(HandlerRole role, ActionStream source, ActionObserver observer) {
        this.role = role;
        this.source = source;
        this.observer = observer;
    }

    @Override
    public boolean hasNext() {
        if (closed || exhausted) {
            return false;
        }
        boolean more;
        try {
            more = source.hasNext();
        } catch (RuntimeException e) {
            throw fail(e);
        }
        if (!more) {
            exhausted = true;
            LOG.info("[" + role + "] Completed streaming " + count + " actions");
        }
        return more;
    }

    @Override
    public ActionRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ActionRecord action;
        try {
            action = source.next();
        } catch (RuntimeException e) {
            throw fail(e);
        }
        count++;
        LOG.fine("[" + role + "] Action " + count + ": " + action.type());
        try {
            observer.onAction(role, count, action);
        } catch (RuntimeException e) {
            throw fail(e);
        }
        return action;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!exhausted) {
            LOG.info("[" + role + "] Stream closed by consumer after " + count + " actions");
        }
        source.close();
    }

    private RuntimeException fail(RuntimeException error) {
        LOG.severe("[" + role + "] Stream failed after " + count + " actions: " + error.getMessage());
        closed = true;
        try {
            source.close();
        } catch (RuntimeException closeError) {
            error.addSuppressed(closeError);
        }
        return error;
    }
}
