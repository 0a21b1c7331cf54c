package org.jrename.rename;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import org.jrename.semantics.RenameSymbol;

public final class RenamedSymbolContext {
    public final String replacementText;
    public final String originalText;
    /** Other names whose bindings may change because of the rename. */
    public final ImmutableSet<String> possibleNameConflicts;

    public final RenameSymbol renamedSymbol;
    public final boolean replacementTextValid;

    public RenamedSymbolContext(
            String replacementText,
            String originalText,
            Collection<String> possibleNameConflicts,
            RenameSymbol renamedSymbol,
            boolean replacementTextValid) {
        this.replacementText = replacementText;
        this.originalText = originalText;
        this.possibleNameConflicts = ImmutableSet.copyOf(possibleNameConflicts);
        this.renamedSymbol = renamedSymbol;
        this.replacementTextValid = replacementTextValid;
    }

    @Override
    public String toString() {
        return String.format("%s: %s -> %s", renamedSymbol, originalText, replacementText);
    }
}
