package org.jrename.conflicts;

import java.util.Objects;
import java.util.Optional;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** The outcome of re-checking one location, in terms of the original text of its document. */
public final class RelatedLocation {
    public final TextSpan conflictCheckSpan;
    public final DocumentId documentId;
    public final RelatedLocationType type;
    public final boolean isReference;
    /** The node that was, or would be, expanded to resolve a conflict here. */
    public final Optional<TextSpan> complexifiedTargetSpan;

    public RelatedLocation(
            TextSpan conflictCheckSpan,
            DocumentId documentId,
            RelatedLocationType type,
            boolean isReference,
            Optional<TextSpan> complexifiedTargetSpan) {
        this.conflictCheckSpan = Objects.requireNonNull(conflictCheckSpan);
        this.documentId = Objects.requireNonNull(documentId);
        this.type = Objects.requireNonNull(type);
        this.isReference = isReference;
        this.complexifiedTargetSpan = Objects.requireNonNull(complexifiedTargetSpan);
    }

    public RelatedLocation(TextSpan conflictCheckSpan, DocumentId documentId, RelatedLocationType type) {
        this(conflictCheckSpan, documentId, type, false, Optional.empty());
    }

    public RelatedLocation withType(RelatedLocationType newType) {
        if (newType == type) return this;
        return new RelatedLocation(conflictCheckSpan, documentId, newType, isReference, complexifiedTargetSpan);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof RelatedLocation)) return false;
        var that = (RelatedLocation) other;
        return this.conflictCheckSpan.equals(that.conflictCheckSpan)
                && this.documentId.equals(that.documentId)
                && this.type == that.type
                && this.isReference == that.isReference
                && this.complexifiedTargetSpan.equals(that.complexifiedTargetSpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conflictCheckSpan, documentId, type, isReference, complexifiedTargetSpan);
    }

    @Override
    public String toString() {
        return String.format("%s %s%s%s", type, documentId, conflictCheckSpan, isReference ? " (reference)" : "");
    }
}
