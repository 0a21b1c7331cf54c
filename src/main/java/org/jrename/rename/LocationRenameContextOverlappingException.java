package org.jrename.rename;

public class LocationRenameContextOverlappingException extends RenameInvariantException {
    public final LocationRenameContext existing, conflicting;

    public LocationRenameContextOverlappingException(LocationRenameContext existing, LocationRenameContext conflicting) {
        super(
                conflicting.renameLocation.documentId,
                conflicting.renameLocation.span,
                String.format(
                        "Span %s of %s is renamed twice: `%s` -> `%s` and `%s` -> `%s`",
                        conflicting.renameLocation.span,
                        conflicting.renameLocation.documentId,
                        existing.originalText,
                        existing.replacementText,
                        conflicting.originalText,
                        conflicting.replacementText));
        this.existing = existing;
        this.conflicting = conflicting;
    }
}
