package org.jrename.rename;

import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

public class StringOrCommentReplacementTextConflictException extends RenameInvariantException {
    public final String existingReplacementText, conflictingReplacementText;

    public StringOrCommentReplacementTextConflictException(
            DocumentId documentId, TextSpan span, String existingReplacementText, String conflictingReplacementText) {
        super(
                documentId,
                span,
                String.format(
                        "String or comment text %s of %s is replaced by both `%s` and `%s`",
                        span, documentId, existingReplacementText, conflictingReplacementText));
        this.existingReplacementText = existingReplacementText;
        this.conflictingReplacementText = conflictingReplacementText;
    }
}
