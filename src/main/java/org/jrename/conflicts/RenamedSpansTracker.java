package org.jrename.conflicts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jrename.rename.SpanEdit;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/**
 * Remembers, per document, the edits that turned its original text into its current text, so positions can be
 * translated in both directions. Documents without edits map every position to itself.
 */
public class RenamedSpansTracker {
    private final Map<DocumentId, ImmutableList<SpanEdit>> documentToModifiedSpansMap = new HashMap<>();

    /** Replaces the edits of a document that was rewritten again from its original text. */
    public void setEdits(DocumentId documentId, List<SpanEdit> edits) {
        var sorted = ImmutableList.sortedCopyOf(edits);
        for (var i = 1; i < sorted.size(); i++) {
            var previous = sorted.get(i - 1).oldSpan;
            var next = sorted.get(i).oldSpan;
            if (next.start < previous.end() || (!previous.isEmpty() && next.start == previous.start)) {
                throw new IllegalArgumentException(
                        String.format("Edits %s and %s of %s overlap", sorted.get(i - 1), sorted.get(i), documentId));
            }
        }
        if (sorted.isEmpty()) {
            documentToModifiedSpansMap.remove(documentId);
        } else {
            documentToModifiedSpansMap.put(documentId, sorted);
        }
    }

    public ImmutableList<SpanEdit> edits(DocumentId documentId) {
        return documentToModifiedSpansMap.getOrDefault(documentId, ImmutableList.of());
    }

    public Set<DocumentId> documentIds() {
        return ImmutableSet.copyOf(documentToModifiedSpansMap.keySet());
    }

    public void clearDocuments(Collection<DocumentId> documentIds) {
        for (var id : documentIds) {
            documentToModifiedSpansMap.remove(id);
        }
    }

    /** Where the token that started at {@code startingPosition} in the original text starts now. */
    public int getAdjustedPosition(int startingPosition, DocumentId documentId) {
        return SpanEdit.adjust(edits(documentId), startingPosition, true);
    }

    public TextSpan getAdjustedSpan(TextSpan span, DocumentId documentId) {
        var edits = edits(documentId);
        var start = SpanEdit.adjust(edits, span.start, true);
        var end = SpanEdit.adjust(edits, span.end(), false);
        return TextSpan.fromBounds(start, Math.max(start, end));
    }

    public int getOriginalPosition(int position, DocumentId documentId) {
        return SpanEdit.unadjust(edits(documentId), position);
    }

    public TextSpan getOriginalSpan(TextSpan span, DocumentId documentId) {
        var edits = edits(documentId);
        var start = SpanEdit.unadjust(edits, span.start);
        var end = SpanEdit.unadjust(edits, span.end());
        return TextSpan.fromBounds(start, Math.max(start, end));
    }

    /** Original span to current span, for every edit of the document. */
    public Map<TextSpan, TextSpan> modifiedSpans(DocumentId documentId) {
        var result = new LinkedHashMap<TextSpan, TextSpan>();
        var delta = 0;
        for (var edit : edits(documentId)) {
            result.put(edit.oldSpan, new TextSpan(edit.oldSpan.start + delta, edit.newText.length()));
            delta += edit.delta();
        }
        return result;
    }
}
