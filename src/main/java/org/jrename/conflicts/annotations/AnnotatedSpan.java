package org.jrename.conflicts.annotations;

import java.util.Objects;
import org.jrename.workspace.TextSpan;

/** An annotation and the span, in the rewritten text, it is attached to. */
public final class AnnotatedSpan {
    public final TextSpan span;
    public final RenameAnnotation annotation;

    public AnnotatedSpan(TextSpan span, RenameAnnotation annotation) {
        this.span = Objects.requireNonNull(span);
        this.annotation = Objects.requireNonNull(annotation);
    }

    @Override
    public String toString() {
        return span + " " + annotation;
    }
}
