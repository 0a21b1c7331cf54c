package org.jrename.rename;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jrename.semantics.RenameSymbol;
import org.jrename.workspace.Solution;

/** Everything the reference search found for one symbol in one snapshot. */
public class SymbolicRenameLocations {
    public final Solution solution;
    public final RenameSymbol symbol;
    public final RenameOptions options;
    public final ImmutableList<RenameLocation> locations;
    /** Statements that call the symbol without naming it, like an enhanced {@code for} calling iterator(). */
    public final ImmutableList<RenameLocation> implicitLocations;
    /** The symbol and the symbols renamed along with it, such as overriding methods. */
    public final ImmutableList<RenameSymbol> referencedSymbols;

    public SymbolicRenameLocations(
            Solution solution,
            RenameSymbol symbol,
            RenameOptions options,
            List<RenameLocation> locations,
            List<RenameLocation> implicitLocations,
            List<RenameSymbol> referencedSymbols) {
        this.solution = solution;
        this.symbol = symbol;
        this.options = options;
        this.locations = ImmutableList.copyOf(locations);
        this.implicitLocations = ImmutableList.copyOf(implicitLocations);
        this.referencedSymbols = ImmutableList.copyOf(referencedSymbols);
    }
}
