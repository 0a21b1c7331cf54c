package org.jrename.java;

import com.sun.source.util.TreePath;
import org.jrename.workspace.TextSpan;

/** An identifier in a compiled document, with the tree it names. */
class NameToken implements Comparable<NameToken> {
    final TextSpan span;
    final String name;
    final TreePath path;
    /** Names the element declared by {@link #path}, rather than referencing one. */
    final boolean declaration;
    /** Method name of a method invocation. */
    final boolean invocation;
    /** Name after {@code ::}. */
    final boolean memberReference;
    /** Part of the {@code package} declaration. */
    final boolean packageName;

    NameToken(
            TextSpan span,
            String name,
            TreePath path,
            boolean declaration,
            boolean invocation,
            boolean memberReference,
            boolean packageName) {
        this.span = span;
        this.name = name;
        this.path = path;
        this.declaration = declaration;
        this.invocation = invocation;
        this.memberReference = memberReference;
        this.packageName = packageName;
    }

    @Override
    public int compareTo(NameToken other) {
        return span.compareTo(other.span);
    }

    @Override
    public String toString() {
        return String.format("%s%s %s", name, span, path.getLeaf().getKind());
    }
}
