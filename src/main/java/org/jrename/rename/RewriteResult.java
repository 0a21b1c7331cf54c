package org.jrename.rename;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jrename.conflicts.annotations.AnnotatedSpan;

/** Output of one per-document rewrite: the new text, the edits that produced it and the annotations on it. */
public class RewriteResult {
    public final String newText;
    /** Sorted by original position. */
    public final ImmutableList<SpanEdit> edits;

    public final ImmutableList<AnnotatedSpan> annotations;

    public RewriteResult(String newText, List<SpanEdit> edits, List<AnnotatedSpan> annotations) {
        this.newText = newText;
        this.edits = ImmutableList.copyOf(edits);
        this.annotations = ImmutableList.copyOf(annotations);
    }

    /** Nothing was edited or annotated, so the document needs no further passes. */
    public boolean isUnchanged() {
        return edits.isEmpty() && annotations.isEmpty();
    }
}
