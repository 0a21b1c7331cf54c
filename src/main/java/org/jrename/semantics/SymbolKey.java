package org.jrename.semantics;

import java.util.Objects;

/**
 * Serializable identity of a symbol, for example {@code lib/Outer.Inner#run(int,java.lang.String)}. Two snapshots of
 * the same program produce equal keys for the same symbol as long as its name and signature are unchanged.
 */
public final class SymbolKey {
    private final String path;

    public SymbolKey(String path) {
        this.path = Objects.requireNonNull(path);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SymbolKey)) return false;
        return path.equals(((SymbolKey) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
