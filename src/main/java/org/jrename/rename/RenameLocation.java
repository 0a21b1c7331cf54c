package org.jrename.rename;

import java.util.Objects;
import java.util.Optional;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** An occurrence of a symbol that the rename rewrites. */
public final class RenameLocation {
    public enum Kind {
        REFERENCE,
        DECLARATION,
        STRING_OR_COMMENT
    }

    public final DocumentId documentId;
    public final TextSpan span;
    public final Kind kind;
    /** For string and comment occurrences, the span of the whole literal or comment. */
    public final Optional<TextSpan> containingStringOrCommentSpan;

    private RenameLocation(DocumentId documentId, TextSpan span, Kind kind, Optional<TextSpan> containing) {
        this.documentId = Objects.requireNonNull(documentId);
        this.span = Objects.requireNonNull(span);
        this.kind = kind;
        this.containingStringOrCommentSpan = containing;
    }

    public static RenameLocation reference(DocumentId documentId, TextSpan span) {
        return new RenameLocation(documentId, span, Kind.REFERENCE, Optional.empty());
    }

    public static RenameLocation declaration(DocumentId documentId, TextSpan span) {
        return new RenameLocation(documentId, span, Kind.DECLARATION, Optional.empty());
    }

    public static RenameLocation stringOrComment(DocumentId documentId, TextSpan span, TextSpan containing) {
        if (!containing.contains(span)) {
            throw new IllegalArgumentException(String.format("%s is not inside %s", span, containing));
        }
        return new RenameLocation(documentId, span, Kind.STRING_OR_COMMENT, Optional.of(containing));
    }

    public boolean isStringOrComment() {
        return kind == Kind.STRING_OR_COMMENT;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof RenameLocation)) return false;
        var that = (RenameLocation) other;
        return this.documentId.equals(that.documentId)
                && this.span.equals(that.span)
                && this.kind == that.kind
                && this.containingStringOrCommentSpan.equals(that.containingStringOrCommentSpan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId, span, kind, containingStringOrCommentSpan);
    }

    @Override
    public String toString() {
        return String.format("%s %s%s", kind, documentId, span);
    }
}
