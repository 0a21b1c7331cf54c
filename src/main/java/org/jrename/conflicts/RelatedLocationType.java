package org.jrename.conflicts;

/** Outcome of checking one location. The flag values match the bit layout callers may already persist. */
public enum RelatedLocationType {
    NO_CONFLICT(0x0),
    RESOLVED_REFERENCE_CONFLICT(0x1),
    RESOLVED_NON_REFERENCE_CONFLICT(0x2),
    POSSIBLY_RESOLVABLE_CONFLICT(0x4),
    UNRESOLVABLE_CONFLICT(0x8),
    UNRESOLVED_CONFLICT(0x4 | 0x8);

    public final int flags;

    RelatedLocationType(int flags) {
        this.flags = flags;
    }

    /** Possibly resolvable, unresolvable or unresolved. */
    public boolean isUnresolved() {
        return (flags & 0xC) != 0;
    }

    /** No later phase may change an outcome of this type. */
    public boolean isFinal() {
        return this != NO_CONFLICT && this != POSSIBLY_RESOLVABLE_CONFLICT;
    }
}
