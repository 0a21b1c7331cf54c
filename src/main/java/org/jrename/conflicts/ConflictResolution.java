package org.jrename.conflicts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.lsp4j.RenameFile;
import org.eclipse.lsp4j.ResourceOperation;
import org.eclipse.lsp4j.TextDocumentEdit;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.jrename.rename.SpanEdit;
import org.jrename.semantics.SymbolKey;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextLines;
import org.jrename.workspace.TextSpan;

/**
 * The result of a rename session: either the renamed snapshot with every checked location, or a failure. Callers must
 * check {@link #isSuccessful()}; a failed result carries no snapshot.
 */
public final class ConflictResolution {
    private final Solution oldSolution;
    private final Optional<Solution> newSolution;
    private final Optional<RenameFailure> failure;
    private final ImmutableList<RelatedLocation> relatedLocations;
    private final ImmutableMap<SymbolKey, String> replacementTexts;
    private final ImmutableMap<SymbolKey, Boolean> symbolToReplacementTextValid;
    private final ImmutableMap<DocumentId, ImmutableList<SpanEdit>> documentEdits;
    private final ImmutableMap<DocumentId, String> renamedDocuments;

    ConflictResolution(
            Solution oldSolution,
            Solution newSolution,
            List<RelatedLocation> relatedLocations,
            Map<SymbolKey, String> replacementTexts,
            Map<SymbolKey, Boolean> symbolToReplacementTextValid,
            Map<DocumentId, ImmutableList<SpanEdit>> documentEdits,
            Map<DocumentId, String> renamedDocuments) {
        this.oldSolution = oldSolution;
        this.newSolution = Optional.of(newSolution);
        this.failure = Optional.empty();
        this.relatedLocations = ImmutableList.copyOf(relatedLocations);
        this.replacementTexts = ImmutableMap.copyOf(replacementTexts);
        this.symbolToReplacementTextValid = ImmutableMap.copyOf(symbolToReplacementTextValid);
        this.documentEdits = ImmutableMap.copyOf(documentEdits);
        this.renamedDocuments = ImmutableMap.copyOf(renamedDocuments);
    }

    private ConflictResolution(Solution oldSolution, RenameFailure failure) {
        this.oldSolution = oldSolution;
        this.newSolution = Optional.empty();
        this.failure = Optional.of(failure);
        this.relatedLocations = ImmutableList.of();
        this.replacementTexts = ImmutableMap.of();
        this.symbolToReplacementTextValid = ImmutableMap.of();
        this.documentEdits = ImmutableMap.of();
        this.renamedDocuments = ImmutableMap.of();
    }

    public static ConflictResolution failed(Solution oldSolution, RenameFailure failure) {
        return new ConflictResolution(oldSolution, failure);
    }

    public boolean isSuccessful() {
        return failure.isEmpty();
    }

    public Optional<RenameFailure> failure() {
        return failure;
    }

    public Solution oldSolution() {
        return oldSolution;
    }

    public Solution newSolution() {
        if (newSolution.isEmpty()) {
            throw new IllegalStateException("Rename failed, there is no new solution: " + failure.get());
        }
        return newSolution.get();
    }

    public List<RelatedLocation> relatedLocations() {
        return relatedLocations;
    }

    public Map<SymbolKey, String> replacementTexts() {
        return replacementTexts;
    }

    public Map<SymbolKey, Boolean> symbolToReplacementTextValid() {
        return symbolToReplacementTextValid;
    }

    public boolean replacementTextValid() {
        return !symbolToReplacementTextValid.containsValue(false);
    }

    /** The number of locations the rename could not make correct. Zero means the rename is fully resolved. */
    public int unresolvedConflictCount() {
        var count = 0;
        for (var location : relatedLocations) {
            if (location.type.isUnresolved()) count++;
        }
        return count;
    }

    /** Documents whose text or name differ between the old and the new solution. */
    public List<DocumentId> documentIds() {
        var result = new ArrayList<DocumentId>();
        var solution = newSolution();
        for (var document : solution.documents()) {
            var old = oldSolution.document(document.id);
            if (!old.text.equals(document.text) || !old.name.equals(document.name)) {
                result.add(document.id);
            }
        }
        return result;
    }

    /** Edits of the original text of a document, sorted and non-overlapping. */
    public List<SpanEdit> edits(DocumentId documentId) {
        newSolution();
        return documentEdits.getOrDefault(documentId, ImmutableList.of());
    }

    /** New file names, by document. */
    public Map<DocumentId, String> renamedDocuments() {
        return renamedDocuments;
    }

    /** Describes the change as text edits of the old documents, followed by file renames. */
    public WorkspaceEdit toWorkspaceEdit() {
        var solution = newSolution();
        var changes = new ArrayList<Either<TextDocumentEdit, ResourceOperation>>();
        for (var id : documentIds()) {
            var old = oldSolution.document(id);
            if (old.text.equals(solution.document(id).text)) continue;
            var lines = new TextLines(old.text);
            var textEdits = new ArrayList<TextEdit>();
            for (var edit : coalesce(edits(id))) {
                if (old.text.substring(edit.oldSpan.start, edit.oldSpan.end()).equals(edit.newText)) continue;
                textEdits.add(new TextEdit(edit.oldSpan.asRange(lines), edit.newText));
            }
            var document = new VersionedTextDocumentIdentifier(old.uri(), null);
            changes.add(Either.forLeft(new TextDocumentEdit(document, textEdits)));
        }
        for (var entry : renamedDocuments.entrySet()) {
            var oldUri = oldSolution.document(entry.getKey()).uri();
            var newUri = solution.document(entry.getKey()).uri();
            changes.add(Either.forRight(new RenameFile(oldUri, newUri)));
        }
        return new WorkspaceEdit(changes);
    }

    /** Merges edits that touch, like a qualifier inserted in front of a renamed name, into one. */
    private static List<SpanEdit> coalesce(List<SpanEdit> edits) {
        var result = new ArrayList<SpanEdit>();
        for (var edit : edits) {
            if (!result.isEmpty()) {
                var last = result.get(result.size() - 1);
                if (last.oldSpan.end() == edit.oldSpan.start) {
                    var span = TextSpan.fromBounds(last.oldSpan.start, edit.oldSpan.end());
                    result.set(result.size() - 1, new SpanEdit(span, last.newText + edit.newText, last.kind));
                    continue;
                }
            }
            result.add(edit);
        }
        return result;
    }
}
