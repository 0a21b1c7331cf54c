package org.jrename.rename;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jrename.semantics.RenameSymbol;
import org.jrename.semantics.SymbolLocation;
import org.jrename.workspace.DocumentId;
import org.jrename.workspace.Solution;
import org.jrename.workspace.TextSpan;

/** The language-specific half of the rename engine. */
public interface RenameRewriterLanguageService {
    /** Renames, expands and annotates one document, starting from its original text. */
    RewriteResult annotateAndRename(RenameRewriterParameters parameters);

    /** Adds names, other than the replacement text itself, whose meaning can change when the symbol is renamed. */
    void tryAddPossibleNameConflicts(
            RenameSymbol symbol, String replacementText, Collection<String> possibleNameConflicts);

    /**
     * Declarations that clash with {@code renamedSymbol} in {@code newSolution}. Locations are in {@code
     * newSolution}; the engine maps them back to the original text.
     */
    List<SymbolLocation> computeDeclarationConflicts(
            String replacementText,
            RenameSymbol renamedSymbol,
            RenameSymbol renameSymbol,
            List<RenameSymbol> referencedSymbols,
            Solution baseSolution,
            Solution newSolution,
            CancellationToken cancellationToken);

    /** Implicit calls of {@code renameSymbol} that no longer reach it. Locations are in the original solution. */
    List<SymbolLocation> computeImplicitReferenceConflicts(
            RenameSymbol renameSymbol,
            RenameSymbol renamedSymbol,
            List<RenameLocation> implicitReferenceLocations,
            CancellationToken cancellationToken);

    /**
     * Implicit calls that would now reach {@code renamedSymbol} although they did not before. Returns locations in
     * the original solution, normally {@code originalDeclarationLocation}.
     */
    List<SymbolLocation> computePossibleImplicitUsageConflicts(
            RenameSymbol renamedSymbol,
            Solution newSolution,
            SymbolLocation originalDeclarationLocation,
            CancellationToken cancellationToken);

    /** Whether the name at {@code token} may now be captured by a local variable or parameter. May over-report. */
    boolean localVariableConflict(
            Solution newSolution, DocumentId documentId, TextSpan token, List<RenameSymbol> newReferencedSymbols);

    boolean isIdentifierValid(String replacementText);

    /** Span of the smallest node, in the original text, whose expansion could fix a conflict at {@code position}. */
    Optional<TextSpan> expansionTargetForLocation(Solution baseSolution, DocumentId documentId, int position);

    /**
     * Drops expansions inside {@code complexifiedSpans} that are no longer needed. {@code currentSolution} holds the
     * document with the text produced by applying {@code edits} to {@code originalText}. Returns the edits to keep.
     */
    List<SpanEdit> simplify(
            Solution currentSolution,
            DocumentId documentId,
            String originalText,
            List<SpanEdit> edits,
            Collection<TextSpan> complexifiedSpans,
            CancellationToken cancellationToken);
}
