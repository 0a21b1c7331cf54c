package org.jrename.conflicts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jrename.rename.CancellationToken;
import org.jrename.rename.LanguageServicesRegistry;
import org.jrename.rename.RenameOptions;
import org.jrename.rename.SymbolicRenameLocations;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolKey;
import org.jrename.workspace.Solution;

/** Entry point of the rename engine. */
public class ConflictResolver {
    private static final Logger LOG = Logger.getLogger("main");

    private final LanguageServicesRegistry languages;

    public ConflictResolver(LanguageServicesRegistry languages) {
        this.languages = languages;
    }

    /**
     * Renames every symbol in {@code symbolsAndReplacements} at once and reports what the new names would break.
     *
     * <p>Conflicts are part of a successful result. A failed result means the rename could not be computed at all;
     * it carries the cause and no new snapshot.
     *
     * @throws IllegalArgumentException if there is nothing to rename, a replacement is blank, or a symbol is not
     *     declared in {@code baseSolution}
     * @throws CancellationException if {@code cancellationToken} is cancelled
     */
    public ConflictResolution resolveConflicts(
            Solution baseSolution,
            Map<RenameSymbol, String> symbolsAndReplacements,
            RenameOptions options,
            CancellationToken cancellationToken) {
        checkArguments(baseSolution, symbolsAndReplacements);
        var started = System.nanoTime();
        try {
            var replacementTexts = new LinkedHashMap<SymbolKey, String>();
            var renameLocationsSet = new ArrayList<SymbolicRenameLocations>();
            for (var entry : symbolsAndReplacements.entrySet()) {
                var symbol = entry.getKey();
                var documentId = symbol.firstSourceLocation().get().documentId.get();
                var finder = languages.forDocument(baseSolution, documentId).finder;
                renameLocationsSet.add(finder.findRenameLocations(baseSolution, symbol, options, cancellationToken));
                replacementTexts.put(symbol.key, entry.getValue());
            }
            var session =
                    RenameSession.create(
                            languages, baseSolution, renameLocationsSet, replacementTexts, options, cancellationToken);
            var result = session.resolve().toConflictResolution();
            var elapsed = (System.nanoTime() - started) / 1_000_000;
            LOG.info(
                    String.format(
                            "Rename touched %d documents with %d unresolved conflicts in %dms",
                            result.documentIds().size(), result.unresolvedConflictCount(), elapsed));
            return result;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Rename failed", e);
            return ConflictResolution.failed(baseSolution, new RenameFailure(e));
        }
    }

    private void checkArguments(Solution baseSolution, Map<RenameSymbol, String> symbolsAndReplacements) {
        if (symbolsAndReplacements.isEmpty()) {
            throw new IllegalArgumentException("No symbols to rename");
        }
        for (var entry : symbolsAndReplacements.entrySet()) {
            var symbol = entry.getKey();
            var replacement = entry.getValue();
            if (replacement == null || replacement.isBlank()) {
                throw new IllegalArgumentException(String.format("Blank replacement for %s", symbol));
            }
            var declaration = symbol.firstSourceLocation();
            if (declaration.isEmpty() || !baseSolution.containsDocument(declaration.get().documentId.get())) {
                throw new IllegalArgumentException(String.format("%s is not declared in the solution", symbol));
            }
            var project = baseSolution.project(declaration.get().documentId.get().projectId);
            if (!languages.languages().contains(project.language)) {
                throw new IllegalArgumentException(String.format("No rename support for language `%s`", project.language));
            }
        }
    }
}
