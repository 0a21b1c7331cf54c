package org.jrename.conflicts;

import org.jrename.rename.SymbolicRenameLocations;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolLocation;

/** A renamed symbol as it appears in the current snapshot, next to what it was in the original one. */
final class RenamedSymbolInfo {
    final SymbolicRenameLocations renameLocations;
    final String replacementText;
    final SymbolLocation originalDeclarationLocation;
    final RenameSymbol renamedSymbol;

    RenamedSymbolInfo(
            SymbolicRenameLocations renameLocations,
            String replacementText,
            SymbolLocation originalDeclarationLocation,
            RenameSymbol renamedSymbol) {
        this.renameLocations = renameLocations;
        this.replacementText = replacementText;
        this.originalDeclarationLocation = originalDeclarationLocation;
        this.renamedSymbol = renamedSymbol;
    }

    RenameSymbol originalSymbol() {
        return renameLocations.symbol;
    }

    boolean nameChanged() {
        return !renamedSymbol.name.equals(originalSymbol().name);
    }
}
