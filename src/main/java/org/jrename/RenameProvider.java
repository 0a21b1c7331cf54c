package org.jrename;

import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.jrename.conflicts.ConflictResolution;
import org.jrename.conflicts.ConflictResolver;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.LanguageServicesRegistry;
import org.jrename.rename.RenameOptions;
import org.jrename.semantics.RenameSymbol;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;

/** Renames whatever is declared or referenced at a position of a document. */
public class RenameProvider {
    private static final Logger LOG = Logger.getLogger("main");

    private final LanguageServicesRegistry languages;
    private final ConflictResolver resolver;

    public RenameProvider(LanguageServicesRegistry languages) {
        this.languages = languages;
        this.resolver = new ConflictResolver(languages);
    }

    public Optional<RenameSymbol> symbolAt(Solution solution, DocumentId documentId, int offset) {
        var services = languages.forDocument(solution, documentId);
        return services.semantics.compile(solution, documentId.projectId).semanticModel(documentId).symbolAt(offset);
    }

    /** @throws IllegalArgumentException if there is no symbol at {@code offset} or it is not declared in source */
    public ConflictResolution rename(
            Solution solution,
            DocumentId documentId,
            int offset,
            String newName,
            RenameOptions options,
            CancellationToken cancellationToken) {
        var symbol = symbolAt(solution, documentId, offset);
        if (symbol.isEmpty()) {
            throw new IllegalArgumentException(String.format("Nothing to rename at %s offset %d", documentId, offset));
        }
        if (symbol.get().firstSourceLocation().isEmpty()) {
            throw new IllegalArgumentException(
                    String.format("%s is not declared in this workspace and cannot be renamed", symbol.get()));
        }
        LOG.info(String.format("Rename %s to `%s` with %s", symbol.get(), newName, options));
        return resolver.resolveConflicts(solution, Map.of(symbol.get(), newName), options, cancellationToken);
    }
}
