package org.jrename.conflicts.annotations;

import org.jrename.workspace.TextSpan;

/** Marks a node that was expanded and should be simplified again once the rename is final. */
public final class RenameNodeSimplificationAnnotation extends RenameAnnotation {
    public final TextSpan originalTextSpan;

    public RenameNodeSimplificationAnnotation(TextSpan originalTextSpan) {
        this.originalTextSpan = originalTextSpan;
    }

    @Override
    public String toString() {
        return "simplify " + originalTextSpan;
    }
}
