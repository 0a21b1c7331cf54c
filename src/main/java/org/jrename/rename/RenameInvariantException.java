package org.jrename.rename;

import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** Two renamed symbols disagree about the same piece of text. Always fatal to the session. */
public abstract class RenameInvariantException extends RuntimeException {
    public final DocumentId documentId;
    public final TextSpan span;

    protected RenameInvariantException(DocumentId documentId, TextSpan span, String message) {
        super(message);
        this.documentId = documentId;
        this.span = span;
    }
}
