package org.jrename.conflicts;

import java.util.Objects;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** A location that is expanded in the next phase, and the node it is expanded through. */
final class ConflictLocationInfo {
    final DocumentId documentId;
    final TextSpan originalIdentifierSpan;
    final TextSpan complexifiedSpan;

    ConflictLocationInfo(RelatedLocation location) {
        this.documentId = location.documentId;
        this.originalIdentifierSpan = location.conflictCheckSpan;
        this.complexifiedSpan =
                location.complexifiedTargetSpan.orElseThrow(
                        () -> new IllegalArgumentException(location + " has no expansion target"));
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof ConflictLocationInfo)) return false;
        var that = (ConflictLocationInfo) other;
        return this.documentId.equals(that.documentId)
                && this.originalIdentifierSpan.equals(that.originalIdentifierSpan)
                && this.complexifiedSpan.equals(that.complexifiedSpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, originalIdentifierSpan, complexifiedSpan);
    }
}
