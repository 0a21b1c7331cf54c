package org.jrename.rename;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation shared by everything that runs inside one rename session. */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static final CancellationToken NONE = new CancellationToken();

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Rename was cancelled");
        }
    }
}
