package org.jrename.semantics;

import java.util.Objects;
import java.util.Optional;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** Where a symbol is declared: a name span in a source document, or a compiled class outside the solution. */
public final class SymbolLocation {
    public final Optional<DocumentId> documentId;
    public final TextSpan span;
    public final String metadataName;

    private SymbolLocation(Optional<DocumentId> documentId, TextSpan span, String metadataName) {
        this.documentId = documentId;
        this.span = span;
        this.metadataName = metadataName;
    }

    public static SymbolLocation source(DocumentId documentId, TextSpan span) {
        return new SymbolLocation(Optional.of(documentId), span, "");
    }

    public static SymbolLocation metadata(String metadataName) {
        return new SymbolLocation(Optional.empty(), TextSpan.EMPTY, metadataName);
    }

    public boolean isInSource() {
        return documentId.isPresent();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SymbolLocation)) return false;
        var that = (SymbolLocation) other;
        return this.documentId.equals(that.documentId)
                && this.span.equals(that.span)
                && this.metadataName.equals(that.metadataName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, span, metadataName);
    }

    @Override
    public String toString() {
        if (isInSource()) return documentId.get() + span.toString();
        return "metadata:" + metadataName;
    }
}
