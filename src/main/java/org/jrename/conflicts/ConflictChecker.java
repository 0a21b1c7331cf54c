package org.jrename.conflicts;

import java.util.List;
import java.util.Set;
import org.jrename.conflicts.annotations.RenameActionAnnotation;
import org.jrename.conflicts.annotations.RenameDeclarationLocationReference;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolKey;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;

/** Compares what a name binds to after the rename with what it bound to before. */
public final class ConflictChecker {
    private ConflictChecker() {}

    /** Translates a start position of the original text into the current text of a document. */
    public interface PositionAdjuster {
        int adjustedStart(DocumentId documentId, int originalStart);
    }

    /**
     * True if the name annotated by {@code annotation} now binds to something other than before.
     *
     * @param newSymbols what the name binds to in the current snapshot, in the order the semantic model reports them
     * @param renamedSymbolKeys keys of every symbol being renamed, as seen in the current snapshot
     */
    public static boolean checkForConflict(
            RenameActionAnnotation annotation,
            List<RenameSymbol> newSymbols,
            Set<SymbolKey> renamedSymbolKeys,
            PositionAdjuster adjuster) {
        var references = annotation.renameDeclarationLocationReferences;
        if (annotation.isNamespaceDeclarationReference) return false;
        if (annotation.isMemberGroupReference) {
            if (references.isEmpty()) return false;
            return !anyLocationMatches(newSymbols, references, adjuster);
        }
        // Ambiguous before the rename, and the rename picked one of them
        if (!annotation.isRenameLocation
                && annotation.isOriginalTextLocation
                && references.size() > 1
                && newSymbols.size() == 1) {
            return false;
        }
        if (references.size() != newSymbols.size()) {
            // Did not compile before, binds now
            return !(newSymbols.size() != 0 && references.size() == 0);
        }
        for (var i = 0; i < references.size(); i++) {
            if (symbolChanged(annotation, references.get(i), newSymbols.get(i), renamedSymbolKeys, adjuster)) {
                return true;
            }
        }
        return false;
    }

    private static boolean symbolChanged(
            RenameActionAnnotation annotation,
            RenameDeclarationLocationReference reference,
            RenameSymbol symbol,
            Set<SymbolKey> renamedSymbolKeys,
            PositionAdjuster adjuster) {
        if (reference.symbolLocationsCount != symbol.locations.size()) return true;
        var newLocation = symbol.firstLocation();
        if (reference.isSourceLocation()) {
            if (newLocation.isEmpty() || !newLocation.get().isInSource()) return true;
            var location = newLocation.get();
            var documentId = reference.documentId.get();
            if (!location.documentId.get().equals(documentId)) return true;
            var adjusted = adjuster.adjustedStart(documentId, reference.textSpan.start);
            if (adjusted != location.span.start) return true;
            if (reference.isOverriddenFromMetadata && !renamedSymbolKeys.contains(symbol.key)) {
                // Still has to override the same compiled method, which cannot be renamed
                return !symbol.isOverride() || !symbol.overriddenMemberInMetadata;
            }
            return false;
        }
        if (newLocation.isEmpty() || newLocation.get().isInSource()) return true;
        return !sameMetadataSymbol(
                reference.name, symbol.metadataName(), annotation.originalText, annotation.replacementText);
    }

    private static boolean anyLocationMatches(
            List<RenameSymbol> newSymbols,
            List<RenameDeclarationLocationReference> references,
            PositionAdjuster adjuster) {
        for (var symbol : newSymbols) {
            for (var location : symbol.locations) {
                if (!location.isInSource()) continue;
                for (var reference : references) {
                    if (matches(location, reference, adjuster)) return true;
                }
            }
        }
        return false;
    }

    private static boolean matches(
            SymbolLocation location, RenameDeclarationLocationReference reference, PositionAdjuster adjuster) {
        if (!reference.isSourceLocation()) return false;
        var documentId = reference.documentId.get();
        if (!location.documentId.get().equals(documentId)) return false;
        return adjuster.adjustedStart(documentId, reference.textSpan.start) == location.span.start;
    }

    /**
     * Compiled symbols cannot be renamed, so a metadata name may only change where the renamed text appears in it,
     * as in the parameter types of a method.
     */
    static boolean sameMetadataSymbol(String oldName, String newName, String originalText, String replacementText) {
        if (oldName.equals(newName)) return true;
        if (originalText.isEmpty()) return false;
        return oldName.replace(originalText, replacementText).equals(newName);
    }
}
