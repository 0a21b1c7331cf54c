package org.jrename.semantics;

import java.util.List;
import java.util.Optional;
import org.jrename.workspace.DocumentId;

/** Symbol lookups for one document of one compiled snapshot. */
public interface SemanticModel {
    DocumentId documentId();

    /**
     * Symbols bound by the name token that contains or ends at {@code position}. Empty if the name does not resolve,
     * more than one if the reference is ambiguous.
     */
    List<RenameSymbol> symbolsTouching(int position);

    /** Symbols of the invocation whose method name starts at {@code position}; the selected overload, if any. */
    List<RenameSymbol> symbolsForEnclosingInvocation(int position);

    /** The symbol declared by the name token at {@code position}, falling back to the symbol it references. */
    Optional<RenameSymbol> symbolAt(int position);
}
