package org.jrename.conflicts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.jrename.rename.SpanEdit;
import org.jrename.semantics.SymbolKey;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/**
 * The result of a rename session while it is being built. Owned by one session and only touched from the thread
 * that runs it.
 */
public class MutableConflictResolution {
    private static final Logger LOG = Logger.getLogger("main");

    public final Solution oldSolution;
    public final RenamedSpansTracker renamedSpansTracker;
    public final ImmutableMap<SymbolKey, String> replacementTexts;
    public final ImmutableMap<SymbolKey, Boolean> symbolToReplacementTextValid;

    private Solution currentSolution;
    private final Map<LocationKey, RelatedLocation> relatedLocations = new LinkedHashMap<>();
    private final Map<DocumentId, String> renamedDocuments = new LinkedHashMap<>();

    public MutableConflictResolution(
            Solution oldSolution,
            RenamedSpansTracker renamedSpansTracker,
            Map<SymbolKey, String> replacementTexts,
            Map<SymbolKey, Boolean> symbolToReplacementTextValid) {
        this.oldSolution = oldSolution;
        this.currentSolution = oldSolution;
        this.renamedSpansTracker = renamedSpansTracker;
        this.replacementTexts = ImmutableMap.copyOf(replacementTexts);
        this.symbolToReplacementTextValid = ImmutableMap.copyOf(symbolToReplacementTextValid);
    }

    public Solution currentSolution() {
        return currentSolution;
    }

    public void updateCurrentSolution(Solution solution) {
        this.currentSolution = Objects.requireNonNull(solution);
    }

    /** Puts documents back to their original text so the next phase can rewrite them from scratch. */
    public void clearDocuments(Collection<DocumentId> documentIds) {
        renamedSpansTracker.clearDocuments(documentIds);
        var texts = new LinkedHashMap<DocumentId, String>();
        for (var id : documentIds) {
            texts.put(id, oldSolution.document(id).text);
        }
        currentSolution = currentSolution.withDocumentTexts(texts);
    }

    public int getAdjustedTokenStartingPosition(int startingPosition, DocumentId documentId) {
        return renamedSpansTracker.getAdjustedPosition(startingPosition, documentId);
    }

    /**
     * Records the outcome of checking a location. A location seen before keeps its place in the log and only moves
     * forward: a pending outcome is replaced, and a pending conflict that now checks clean becomes resolved. Final
     * outcomes never change.
     */
    public void addRelatedLocation(RelatedLocation location) {
        var key = new LocationKey(location);
        var existing = relatedLocations.get(key);
        if (existing == null) {
            relatedLocations.put(key, location);
            return;
        }
        if (existing.type.isFinal()) return;
        var type = location.type;
        if (existing.type == RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT && type == RelatedLocationType.NO_CONFLICT) {
            type =
                    location.isReference
                            ? RelatedLocationType.RESOLVED_REFERENCE_CONFLICT
                            : RelatedLocationType.RESOLVED_NON_REFERENCE_CONFLICT;
        }
        var complexified = location.complexifiedTargetSpan.or(() -> existing.complexifiedTargetSpan);
        var merged =
                new RelatedLocation(
                        location.conflictCheckSpan, location.documentId, type, existing.isReference, complexified);
        relatedLocations.put(key, merged);
    }

    /** Like {@link #addRelatedLocation}, but only for a location that was already recorded. */
    public void updateRelatedLocationIfPresent(RelatedLocation location) {
        if (relatedLocations.containsKey(new LocationKey(location))) {
            addRelatedLocation(location);
        }
    }

    /** Records a conflict found outside the phase loop. It overrides whatever the location had before. */
    public void addOrReplaceRelatedLocation(RelatedLocation location) {
        relatedLocations.put(new LocationKey(location), location);
    }

    public List<RelatedLocation> relatedLocations() {
        return ImmutableList.copyOf(relatedLocations.values());
    }

    /** Once no more phases will run, a conflict that might have been resolved is unresolved. */
    public void downgradePossiblyResolvableConflicts() {
        for (var entry : relatedLocations.entrySet()) {
            if (entry.getValue().type == RelatedLocationType.POSSIBLY_RESOLVABLE_CONFLICT) {
                entry.setValue(entry.getValue().withType(RelatedLocationType.UNRESOLVED_CONFLICT));
            }
        }
    }

    /** Renames a document after the type it declares, unless that name is taken in its folder. */
    public void renameDocumentToMatchNewSymbol(DocumentId documentId, String replacementText) {
        var document = currentSolution.document(documentId);
        var fileName = document.fileName();
        var dot = fileName.lastIndexOf('.');
        var extension = dot == -1 ? "" : fileName.substring(dot);
        var newName = replacementText + extension;
        if (newName.equals(fileName)) return;
        var taken = currentSolution.findDocumentByName(documentId.projectId, document.folder() + newName);
        if (taken.isPresent()) {
            LOG.warning(String.format("Not renaming %s, %s already exists", document.name, taken.get().name));
            return;
        }
        LOG.info(String.format("Renaming %s to %s", document.name, newName));
        currentSolution = currentSolution.withDocumentFileName(documentId, newName);
        renamedDocuments.put(documentId, newName);
    }

    public ConflictResolution toConflictResolution() {
        var edits = new LinkedHashMap<DocumentId, ImmutableList<SpanEdit>>();
        for (var id : renamedSpansTracker.documentIds()) {
            edits.put(id, renamedSpansTracker.edits(id));
        }
        return new ConflictResolution(
                oldSolution,
                currentSolution,
                new ArrayList<>(relatedLocations.values()),
                replacementTexts,
                symbolToReplacementTextValid,
                edits,
                renamedDocuments);
    }

    private static final class LocationKey {
        final DocumentId documentId;
        final TextSpan span;

        LocationKey(RelatedLocation location) {
            this.documentId = location.documentId;
            this.span = location.conflictCheckSpan;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof LocationKey)) return false;
            var that = (LocationKey) other;
            return this.documentId.equals(that.documentId) && this.span.equals(that.span);
        }

        @Override
        public int hashCode() {
            return Objects.hash(documentId, span);
        }
    }
}
