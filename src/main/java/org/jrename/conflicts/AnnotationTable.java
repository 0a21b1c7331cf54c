package org.jrename.conflicts;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.TextSpan;

/**
 * Side table of annotations keyed by document and by span in the document's current text. Kept outside the
 * documents so snapshots stay immutable; a document's entries are dropped whenever it is rewritten again.
 */
public class AnnotationTable<T> {
    private final Map<DocumentId, TreeMap<TextSpan, List<T>>> documents = new HashMap<>();

    public void add(DocumentId documentId, TextSpan span, T annotation) {
        var spans = documents.computeIfAbsent(documentId, k -> new TreeMap<>());
        spans.computeIfAbsent(span, k -> new ArrayList<>()).add(annotation);
    }

    public NavigableSet<TextSpan> annotatedSpans(DocumentId documentId) {
        var spans = documents.get(documentId);
        if (spans == null) return new TreeSet<>();
        return new TreeSet<>(spans.keySet());
    }

    public <A extends T> List<A> annotations(DocumentId documentId, TextSpan span, Class<A> type) {
        var result = new ArrayList<A>();
        var spans = documents.get(documentId);
        if (spans == null) return result;
        for (var annotation : spans.getOrDefault(span, List.of())) {
            if (type.isInstance(annotation)) result.add(type.cast(annotation));
        }
        return result;
    }

    /** Every annotation of {@code type} in a document, in span order. */
    public <A extends T> List<A> annotations(DocumentId documentId, Class<A> type) {
        var result = new ArrayList<A>();
        for (var span : annotatedSpans(documentId)) {
            result.addAll(annotations(documentId, span, type));
        }
        return result;
    }

    public boolean hasAnnotation(DocumentId documentId, TextSpan span, Class<? extends T> type) {
        return !annotations(documentId, span, type).isEmpty();
    }

    public boolean isEmpty(DocumentId documentId) {
        var spans = documents.get(documentId);
        return spans == null || spans.isEmpty();
    }

    public void clear(DocumentId documentId) {
        documents.remove(documentId);
    }

    public void clear(Collection<DocumentId> documentIds) {
        for (var id : documentIds) clear(id);
    }
}
