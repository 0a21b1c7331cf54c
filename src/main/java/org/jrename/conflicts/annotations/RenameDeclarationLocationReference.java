package org.jrename.conflicts.annotations;

import java.util.Optional;
import org.jrename.semantics.RenameSymbol;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/** What a name bound to before the rename, recorded so it can be compared with what it binds to afterwards. */
public final class RenameDeclarationLocationReference {
    public final Optional<DocumentId> documentId;
    public final TextSpan textSpan;
    /** Metadata name, for symbols that are not declared in source. */
    public final String name;

    public final int symbolLocationsCount;
    public final boolean isOverriddenFromMetadata;

    private RenameDeclarationLocationReference(
            Optional<DocumentId> documentId,
            TextSpan textSpan,
            String name,
            int symbolLocationsCount,
            boolean isOverriddenFromMetadata) {
        this.documentId = documentId;
        this.textSpan = textSpan;
        this.name = name;
        this.symbolLocationsCount = symbolLocationsCount;
        this.isOverriddenFromMetadata = isOverriddenFromMetadata;
    }

    public static RenameDeclarationLocationReference source(
            DocumentId documentId, TextSpan textSpan, int symbolLocationsCount, boolean isOverriddenFromMetadata) {
        return new RenameDeclarationLocationReference(
                Optional.of(documentId), textSpan, "", symbolLocationsCount, isOverriddenFromMetadata);
    }

    public static RenameDeclarationLocationReference metadata(String name, int symbolLocationsCount) {
        return new RenameDeclarationLocationReference(
                Optional.empty(), TextSpan.EMPTY, name, symbolLocationsCount, false);
    }

    public static RenameDeclarationLocationReference of(RenameSymbol symbol) {
        var location = symbol.firstLocation();
        if (location.isPresent() && location.get().isInSource()) {
            var overriddenFromMetadata = symbol.isOverride() && symbol.overriddenMemberInMetadata;
            return source(
                    location.get().documentId.get(),
                    location.get().span,
                    symbol.locations.size(),
                    overriddenFromMetadata);
        }
        return metadata(symbol.metadataName(), symbol.locations.size());
    }

    public boolean isSourceLocation() {
        return documentId.isPresent();
    }

    @Override
    public String toString() {
        if (isSourceLocation()) return documentId.get() + textSpan.toString();
        return "metadata:" + name;
    }
}
