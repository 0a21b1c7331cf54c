package org.jrename.rename;

import java.util.Set;
import org.jrename.semantics.RenameSymbol;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;

/** Reference search for one language. */
public interface RenameLocationFinder {
    SymbolicRenameLocations findRenameLocations(
            Solution solution, RenameSymbol symbol, RenameOptions options, CancellationToken cancellationToken);

    /** Documents where the rename could change a binding, whether or not they contain a rename location. */
    Set<DocumentId> documentsAffectedByRename(Solution solution, SymbolicRenameLocations locations);
}
