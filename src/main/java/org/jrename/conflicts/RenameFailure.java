package org.jrename.conflicts;

import java.util.Objects;

/** Why a rename session was abandoned. A failed session has no resulting snapshot. */
public final class RenameFailure {
    public final String message;
    public final RuntimeException cause;

    public RenameFailure(RuntimeException cause) {
        this.cause = Objects.requireNonNull(cause);
        this.message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return message;
    }
}
