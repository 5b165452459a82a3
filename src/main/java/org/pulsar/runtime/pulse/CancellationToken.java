package org.pulsar.runtime.pulse;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a pulse. The scheduler polls it once per subpulse
 * boundary; it never preempts a running pipeline pass.
 * <p>
 * May be cancelled from any thread.
 */
public class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
