package io.planbridge.core.dispatch;

import io.planbridge.core.plan.ActionRecord;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Lazy, ordered, single-consumer sequence of actions.
///
/// Actions are produced as the consumer asks for them.
///
/// ### Contracts
/// - **Ordering**: actions arrive exactly in the order the transport produced them
/// - **Cancellation**: stopping early and calling {@link #close()} cancels the stream
/// - **Postcondition**: after closing, {@link #hasNext()} returns false
///
/// {@snippet :
/// try (ActionStream actions = handler.stream(call)) {
///     while (actions.hasNext()) {
///         engine.apply(actions.next());
///     }
/// }
/// }
public interface ActionStream extends Iterator<ActionRecord>, AutoCloseable {

    /// Cancels the stream and releases its resources. Idempotent.
    @Override
    void close();

    static ActionStream of(List<ActionRecord> actions) {
        return fromIterator(List.copyOf(actions).iterator(), () -> {});
    }

    /// Adapts an iterator.
    ///
    /// @param source action source, not null
    /// @param onClose runs once on the first {@link #close()}, not null
    /// @return stream over the iterator, never null
    static ActionStream fromIterator(Iterator<ActionRecord> source, Runnable onClose) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(onClose, "onClose must not be null");
        return new ActionStream() {
            private boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && source.hasNext();
            }

            @Override
            public ActionRecord next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return source.next();
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    onClose.run();
                }
            }
        };
    }
}
